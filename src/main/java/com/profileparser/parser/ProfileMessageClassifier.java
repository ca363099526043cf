package com.profileparser.parser;

import com.profileparser.model.LogMetadata;
import com.profileparser.model.OperationKind;
import com.profileparser.model.OperationRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the message part of a PROFILE line into an {@link OperationRecord}.
 *
 * Messages are tried against a fixed list of patterns; the first match decides
 * the operation kind and which capture groups become tags. A message that
 * matches none of them is kept as an {@link OperationKind#OTHER} operation.
 * @author kiransahoo
 */
public class ProfileMessageClassifier {

    public static final String OP_TYPE_TAG = "puppet.op_type";
    public static final String COMPONENT_TAG = "component";
    public static final String SPAN_KIND_TAG = "span.kind";
    public static final String HTTP_METHOD_TAG = "http.method";
    public static final String HTTP_URL_TAG = "http.url";
    public static final String PEER_HOSTNAME_TAG = "peer.hostname";

    // "<span id> <message>: took <seconds> seconds"
    static final Pattern COMMON_DATA = Pattern.compile(
            "(?<spanId>[\\d.]+)\\s+(?<message>.*):\\stook\\s(?<duration>[\\d.]+)\\sseconds$");

    static final Pattern FUNCTION_CALL = Pattern.compile("Called (?<name>\\S+)");
    static final Pattern RESOURCE_EVAL = Pattern.compile(
            "Evaluated resource (?<name>(?<resourceType>[\\w:]+)\\[(?<resourceTitle>.*)])");
    static final Pattern PUPPETDB_OP = Pattern.compile(
            "PuppetDB: (?<name>[^(]*)(?:\\s\\([\\w\\s]*: \\d+\\))?\\Z");
    // Most PuppetDB versions log queries without the "PuppetDB: " prefix
    static final Pattern PUPPETDB_QUERY = Pattern.compile("(?<name>Submitted query .*)");

    private static final String HOSTNAME =
            "\\b(?:[0-9A-Za-z][0-9A-Za-z-]{0,62})(?:\\.(?:[0-9A-Za-z][0-9A-Za-z-]{0,62}))*(?:\\.?|\\b)";
    static final Pattern CERTNAME_REQUEST = Pattern.compile(
            "Processed\\srequest\\s(?<method>[A-Z]+)\\s(?<name>.*/)(?<hostname>" + HOSTNAME + ")?\\Z");
    static final Pattern HTTP_REQUEST = Pattern.compile("Processed request (?<method>[A-Z]+) (?<name>.*/)");

    private static final List<MessagePattern> PATTERNS = List.of(
            new MessagePattern(OperationKind.FUNCTION_CALL, FUNCTION_CALL, Map.of()),
            new MessagePattern(OperationKind.RESOURCE_EVAL, RESOURCE_EVAL, Map.of(
                    "resourceType", OperationRecord.RESOURCE_TYPE_TAG,
                    "resourceTitle", OperationRecord.RESOURCE_TITLE_TAG)),
            new MessagePattern(OperationKind.PUPPETDB_CALL, PUPPETDB_OP, Map.of()),
            new MessagePattern(OperationKind.PUPPETDB_CALL, PUPPETDB_QUERY, Map.of()),
            new MessagePattern(OperationKind.HTTP_REQUEST, CERTNAME_REQUEST, Map.of(
                    "method", HTTP_METHOD_TAG,
                    "hostname", PEER_HOSTNAME_TAG)),
            new MessagePattern(OperationKind.HTTP_REQUEST, HTTP_REQUEST, Map.of(
                    "method", HTTP_METHOD_TAG)));

    private final String serverUrl;
    private final String serviceName;

    public ProfileMessageClassifier(String serverUrl, String serviceName) {
        this.serverUrl = serverUrl;
        this.serviceName = serviceName;
    }

    /**
     * @return the record, or empty if the message lacks a span id or duration
     */
    public Optional<OperationRecord> classify(String message, LogMetadata metadata) {
        Matcher common = COMMON_DATA.matcher(message);
        if (!common.find()) {
            return Optional.empty();
        }

        String spanId = common.group("spanId");
        String operation = common.group("message");
        double duration = parseDuration(common.group("duration"), message);

        Map<String, String> tags = new LinkedHashMap<>();
        String name = operation;
        OperationKind kind = OperationKind.OTHER;

        for (MessagePattern pattern : PATTERNS) {
            Matcher matcher = pattern.getPattern().matcher(operation);
            if (!matcher.find()) {
                continue;
            }
            kind = pattern.getKind();
            name = matcher.group("name");
            pattern.getTagGroups().forEach((group, tag) -> {
                String value = matcher.group(group);
                if (value != null && !value.isEmpty()) {
                    tags.put(tag, value);
                }
            });
            break;
        }

        tags.put(OP_TYPE_TAG, kind.getTagValue());
        if (kind == OperationKind.HTTP_REQUEST) {
            tags.put(HTTP_URL_TAG, serverUrl + name + tags.getOrDefault(PEER_HOSTNAME_TAG, ""));
        }
        tags.put(COMPONENT_TAG, serviceName);
        tags.put(SPAN_KIND_TAG, "server");

        return Optional.of(OperationRecord.builder()
                .spanId(spanId)
                .kind(kind)
                .name(name)
                .durationSeconds(duration)
                .finishTime(metadata == null ? null : metadata.getTimestamp())
                .tags(tags)
                .build());
    }

    private static double parseDuration(String value, String message) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ProfileParseException("Invalid duration " + value + " in PROFILE message: " + message, e);
        }
    }

    private static class MessagePattern {
        private final OperationKind kind;
        private final Pattern pattern;
        // capture group name -> tag name
        private final Map<String, String> tagGroups;

        MessagePattern(OperationKind kind, Pattern pattern, Map<String, String> tagGroups) {
            this.kind = kind;
            this.pattern = pattern;
            this.tagGroups = tagGroups;
        }

        OperationKind getKind() {
            return kind;
        }

        Pattern getPattern() {
            return pattern;
        }

        Map<String, String> getTagGroups() {
            return tagGroups;
        }
    }
}
