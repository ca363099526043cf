package com.profileparser;

import com.profileparser.config.ProfileParserProperties;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * puppet-profile-parser - Puppet Server PROFILE log analyzer
 * @author kiransahoo
 */
@SpringBootApplication
@EnableConfigurationProperties(ProfileParserProperties.class)
public class ProfileParserApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(ProfileParserApplication.class);
        application.setBannerMode(Banner.Mode.OFF);
        application.setLogStartupInfo(false);
        // Arguments belong to the CLI, not to the Spring environment
        application.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(application.run(args)));
    }
}
