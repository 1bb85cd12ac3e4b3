package io.github.nabilcarel.gateway;

import io.github.nabilcarel.gateway.util.UrlRewriter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class UrlRewriterTest {

    private static final String ORIGIN = "http://backend:8020/odata/Customers";
    private static final String TARGET = "https://gw.example.com/api/prod/Customers";

    @Test
    void testRewrite_replacesBaseWithSuffix() {
        String content = "{\"next\":\"http://backend:8020/odata/Customers?$skip=10\"}";

        assertThat(UrlRewriter.rewrite(content, ORIGIN, TARGET))
                .isEqualTo("{\"next\":\"https://gw.example.com/api/prod/Customers?$skip=10\"}");
    }

    @Test
    void testRewrite_keysAndSubPaths() {
        String content = "http://backend:8020/odata/Customers('C1') http://backend:8020/odata/Customers/Orders";

        assertThat(UrlRewriter.rewrite(content, ORIGIN, TARGET))
                .isEqualTo("https://gw.example.com/api/prod/Customers('C1') https://gw.example.com/api/prod/Customers/Orders");
    }

    @Test
    void testRewrite_leavesLongerSegmentsAlone() {
        String content = "http://backend:8020/odata/CustomersArchive";

        assertThat(UrlRewriter.rewrite(content, ORIGIN, TARGET)).isEqualTo(content);
    }

    @Test
    void testRewrite_doesNotMatchOtherPort() {
        String content = "http://host:8080/svc";

        assertThat(UrlRewriter.rewrite(content, "http://host:80/svc", "https://gw/api/prod/Svc")).isEqualTo(content);
    }

    @Test
    void testRewrite_defaultPortWrittenOrOmitted() {
        String content = "http://host/svc/a http://host:80/svc/b";

        assertThat(UrlRewriter.rewrite(content, "http://host/svc", "https://gw/api/prod/Svc"))
                .isEqualTo("https://gw/api/prod/Svc/a https://gw/api/prod/Svc/b");
    }

    @Test
    void testRewrite_escapedSlashes() {
        String content = "{\"url\":\"http:\\/\\/backend:8020\\/odata\\/Customers(1)\"}";

        assertThat(UrlRewriter.rewrite(content, ORIGIN, TARGET))
                .isEqualTo("{\"url\":\"https:\\/\\/gw.example.com\\/api\\/prod\\/Customers(1)\"}");
    }

    @Test
    void testRewrite_hostOnlyOrigin() {
        String content = "see http://backend:8020/other";

        assertThat(UrlRewriter.rewrite(content, "http://backend:8020", "https://gw/api/prod/Root"))
                .isEqualTo("see https://gw/api/prod/Root/other");
    }

    @Test
    void testRewrite_nothingToDo() {
        assertThat(UrlRewriter.rewrite("", ORIGIN, TARGET)).isEmpty();
        assertThat(UrlRewriter.rewrite(null, ORIGIN, TARGET)).isNull();
        assertThat(UrlRewriter.rewrite("plain text", ORIGIN, TARGET)).isEqualTo("plain text");
        assertThat(UrlRewriter.rewrite("plain text", null, TARGET)).isEqualTo("plain text");
    }
}
