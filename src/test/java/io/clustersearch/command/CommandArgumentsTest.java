package io.clustersearch.command;

import io.clustersearch.enums.CommandAction;
import io.clustersearch.exceptions.InvalidQueryConfigurationException;
import io.clustersearch.models.SearchOptions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandArgumentsTest {

    @Test
    void testParse_SearchOptions() {
        SearchOptions options = CommandArguments.parse(new String[]{
            "eaddr=nodeA:9200,nodeB:9200", "index=logs-*", "query=\"status:500 AND host:web*\"",
            "earliest=now-4h", "latest=now", "tsfield=event_time", "fields=host, status,,message",
            "limit=100", "page_size=50", "include_es=yes", "include_raw=1", "scan=false"});

        assertThat(options.getAction()).isEqualTo(CommandAction.SEARCH);
        assertThat(options.getEaddr()).isEqualTo("nodeA:9200,nodeB:9200");
        assertThat(options.getIndex()).isEqualTo("logs-*");
        assertThat(options.getQuery()).isEqualTo("status:500 AND host:web*");
        assertThat(options.getEarliest()).isEqualTo("now-4h");
        assertThat(options.getLatest()).isEqualTo("now");
        assertThat(options.getTimestampField()).isEqualTo("event_time");
        assertThat(options.getFields()).containsExactly("host", "status", "message");
        assertThat(options.getLimit()).isEqualTo(100);
        assertThat(options.getPageSize()).isEqualTo(50);
        assertThat(options.isIncludeEs()).isTrue();
        assertThat(options.isIncludeRaw()).isTrue();
        assertThat(options.isScan()).isFalse();
        assertThat(options.getUseSsl()).isNull();
    }

    @Test
    void testParse_Defaults() {
        SearchOptions options = CommandArguments.parse(new String[]{"index=logs"});

        assertThat(options.isScan()).isTrue();
        assertThat(options.getLimit()).isZero();
        assertThat(options.getPageSize()).isNull();
        assertThat(options.isIncludeEs()).isFalse();
        assertThat(options.getFields()).isEmpty();
    }

    @Test
    void testParse_LastValueWinsAndKeysAreCaseInsensitive() {
        SearchOptions options = CommandArguments.parse(new String[]{"INDEX=a", "index=b", "Action=cluster-health"});

        assertThat(options.getIndex()).isEqualTo("b");
        assertThat(options.getAction()).isEqualTo(CommandAction.CLUSTER_HEALTH);
    }

    @Test
    void testParse_ArgumentLine() {
        SearchOptions options = CommandArguments.parse(
            "eaddr=prod  index=logs query=\"message:\\\"disk full\\\" AND level:error\" use_ssl=t verify_certs=n");

        assertThat(options.getEaddr()).isEqualTo("prod");
        assertThat(options.getQuery()).isEqualTo("message:\"disk full\" AND level:error");
        assertThat(options.getUseSsl()).isTrue();
        assertThat(options.getVerifyCerts()).isFalse();
    }

    @Test
    void testTokenize_UnterminatedQuote() {
        assertThatThrownBy(() -> CommandArguments.tokenize("query=\"status:500"))
            .isInstanceOf(InvalidQueryConfigurationException.class)
            .hasMessageContaining("Unterminated quote");
    }

    @Test
    void testParse_DocumentTypeIgnored() {
        SearchOptions options = CommandArguments.parse(new String[]{"index=logs", "stype=event", "query=*"});

        assertThat(options.getIndex()).isEqualTo("logs");
        assertThat(options.getQuery()).isEqualTo("*");
    }

    @Test
    void testParse_InvalidArguments() {
        assertThatThrownBy(() -> CommandArguments.parse(new String[]{"logs-*"}))
            .isInstanceOf(InvalidQueryConfigurationException.class)
            .hasMessageContaining("key=value");
        assertThatThrownBy(() -> CommandArguments.parse(new String[]{"size=10"}))
            .isInstanceOf(InvalidQueryConfigurationException.class)
            .hasMessageContaining("Unknown option 'size'");
        assertThatThrownBy(() -> CommandArguments.parse(new String[]{"scan=maybe"}))
            .isInstanceOf(InvalidQueryConfigurationException.class)
            .hasMessageContaining("boolean");
        assertThatThrownBy(() -> CommandArguments.parse(new String[]{"limit=-1"}))
            .isInstanceOf(InvalidQueryConfigurationException.class)
            .hasMessageContaining("at least 0");
        assertThatThrownBy(() -> CommandArguments.parse(new String[]{"page_size=0"}))
            .isInstanceOf(InvalidQueryConfigurationException.class);
        assertThatThrownBy(() -> CommandArguments.parse(new String[]{"limit=ten"}))
            .isInstanceOf(InvalidQueryConfigurationException.class)
            .hasMessageContaining("integer");
        assertThatThrownBy(() -> CommandArguments.parse(new String[]{"action=drop-index"}))
            .isInstanceOf(InvalidQueryConfigurationException.class);
    }
}
