package com.profileparser.parser;

import com.profileparser.model.LogMetadata;
import com.profileparser.model.OperationKind;
import com.profileparser.model.OperationRecord;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProfileMessageClassifierTest {

    private static final OffsetDateTime TIMESTAMP = OffsetDateTime.of(2018, 2, 18, 18, 43, 53, 0, ZoneOffset.UTC);
    private static final LogMetadata METADATA = LogMetadata.builder()
            .timestamp(TIMESTAMP)
            .threadId("qtp-1")
            .build();

    private final ProfileMessageClassifier classifier =
            new ProfileMessageClassifier("https://puppetserver.example:8140", "puppetserver");

    private OperationRecord classify(String message) {
        return classifier.classify(message, METADATA).orElseThrow();
    }

    @Test
    void readsSpanIdAndDuration() {
        OperationRecord record = classify("1.2.3 Called include: took 0.0123 seconds");

        assertThat(record.getSpanId()).isEqualTo("1.2.3");
        assertThat(record.getDurationSeconds()).isEqualTo(0.0123);
        assertThat(record.getFinishTime()).isEqualTo(TIMESTAMP);
        assertThat(record.isRoot()).isFalse();
    }

    @Test
    void classifiesFunctionCalls() {
        OperationRecord record = classify("1.1 Called lookup: took 0.2000 seconds");

        assertThat(record.getKind()).isEqualTo(OperationKind.FUNCTION_CALL);
        assertThat(record.getName()).isEqualTo("lookup");
        assertThat(record.getTags())
                .containsEntry("puppet.op_type", "function_call")
                .containsEntry("component", "puppetserver")
                .containsEntry("span.kind", "server");
    }

    @Test
    void classifiesResourceEvaluations() {
        OperationRecord record = classify("1.4 Evaluated resource Apache::Vhost[default ssl]: took 0.0100 seconds");

        assertThat(record.getKind()).isEqualTo(OperationKind.RESOURCE_EVAL);
        assertThat(record.getName()).isEqualTo("Apache::Vhost[default ssl]");
        assertThat(record.getResourceType()).isEqualTo("Apache::Vhost");
        assertThat(record.getTags()).containsEntry("puppet.resource_title", "default ssl");
        assertThat(record.getAggregateName()).isEqualTo("Apache::Vhost");
    }

    @Test
    void keepsClassNamesWhenAggregating() {
        OperationRecord record = classify("1.4 Evaluated resource Class[Profile::Base]: took 0.0100 seconds");

        assertThat(record.getAggregateName()).isEqualTo("Class[Profile::Base]");
    }

    @Test
    void classifiesPuppetDbOperations() {
        OperationRecord record = classify("1.5 PuppetDB: Search facts (query count: 1): took 0.0500 seconds");

        assertThat(record.getKind()).isEqualTo(OperationKind.PUPPETDB_CALL);
        assertThat(record.getName()).isEqualTo("Search facts");
    }

    @Test
    void classifiesPuppetDbQueriesWithoutPrefix() {
        OperationRecord record = classify("1.6 Submitted query [\"from\", \"nodes\"]: took 0.1000 seconds");

        assertThat(record.getKind()).isEqualTo(OperationKind.PUPPETDB_CALL);
        assertThat(record.getName()).isEqualTo("Submitted query [\"from\", \"nodes\"]");
    }

    @Test
    void classifiesHttpRequestsWithCertname() {
        OperationRecord record = classify(
                "1 Processed request GET /puppet/v3/node/pe-201734-master.puppetdebug.vlan: took 0.1640 seconds");

        assertThat(record.getKind()).isEqualTo(OperationKind.HTTP_REQUEST);
        assertThat(record.getName()).isEqualTo("/puppet/v3/node/");
        assertThat(record.isRoot()).isTrue();
        assertThat(record.getTags())
                .containsEntry("http.method", "GET")
                .containsEntry("peer.hostname", "pe-201734-master.puppetdebug.vlan")
                .containsEntry("http.url",
                        "https://puppetserver.example:8140/puppet/v3/node/pe-201734-master.puppetdebug.vlan");
    }

    @Test
    void classifiesHttpRequestsWithoutHostname() {
        OperationRecord record = classify("1 Processed request PUT /puppet/v3/file_metadatas/: took 0.5000 seconds");

        assertThat(record.getKind()).isEqualTo(OperationKind.HTTP_REQUEST);
        assertThat(record.getName()).isEqualTo("/puppet/v3/file_metadatas/");
        assertThat(record.getTags())
                .containsEntry("http.method", "PUT")
                .containsEntry("http.url", "https://puppetserver.example:8140/puppet/v3/file_metadatas/")
                .doesNotContainKey("peer.hostname");
    }

    @Test
    void fallsBackToHttpRequestWhenTheTailIsNotAHostname() {
        OperationRecord record = classify(
                "1 Processed request GET /puppet/v3/catalog/node1?environment=production: took 1.2000 seconds");

        assertThat(record.getKind()).isEqualTo(OperationKind.HTTP_REQUEST);
        assertThat(record.getName()).isEqualTo("/puppet/v3/catalog/");
        assertThat(record.getTags()).doesNotContainKey("peer.hostname");
    }

    @Test
    void keepsUnrecognizedMessagesAsOther() {
        OperationRecord record = classify("1.3 Compiled catalog for agent2 in environment production: took 0.0500 seconds");

        assertThat(record.getKind()).isEqualTo(OperationKind.OTHER);
        assertThat(record.getName()).isEqualTo("Compiled catalog for agent2 in environment production");
        assertThat(record.getTags()).containsEntry("puppet.op_type", "other");
    }

    @Test
    void returnsNothingWithoutCommonData() {
        assertThat(classifier.classify("1.3 Compiled something", METADATA)).isEmpty();
    }

    @Test
    void failsOnMalformedDurations() {
        assertThatThrownBy(() -> classifier.classify("1.3 Called x: took 1.2.3 seconds", METADATA))
                .isInstanceOf(ProfileParseException.class)
                .hasMessageContaining("1.2.3");
    }
}
