package com.profileparser.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@Data
@ConfigurationProperties(prefix = "profile-parser")
public class ProfileParserProperties {
    private String version = "unknown";
    private String profileTag = "PROFILE";
    private String defaultFormat = "human";
    // null means: decide from the terminal
    private Boolean color;
    // Applied to timestamps logged without an offset, system zone when unset
    private String timeZone;
    private String serviceName = "puppetserver";
    // TODO: read the server's real hostname from the logs instead of an RFC 2606 example domain
    private String serverUrl = "https://puppetserver.example:8140";
    private int summaryColumnWidth = 50;

    public ZoneId resolveZoneId() {
        return timeZone == null || timeZone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timeZone);
    }
}
