package io.github.nabilcarel.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nabilcarel.gateway.config.GatewayProperties;
import io.github.nabilcarel.gateway.service.ErrorDetailExtractor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ErrorDetailExtractorTest {

    private final GatewayProperties properties = new GatewayProperties();
    private final ErrorDetailExtractor extractor = new ErrorDetailExtractor(new ObjectMapper(), properties);

    @Test
    void testExtract_odataLocalizedMessage() {
        ErrorDetailExtractor.ErrorDetail detail = extractor.extract(
                "{\"error\":{\"code\":\"-1\",\"message\":{\"lang\":\"en-US\",\"value\":\"Customer is blocked\"}}}");

        assertThat(detail.getDetail()).isEqualTo("Customer is blocked");
        assertThat(detail.getStructuredError().at("/error/code").asText()).isEqualTo("-1");
    }

    @Test
    void testExtract_plainErrorMessage() {
        assertThat(extractor.extract("{\"error\":{\"message\":\"Not allowed\"}}").getDetail())
                .isEqualTo("Not allowed");
        assertThat(extractor.extract("{\"message\":\"Bad input\"}").getDetail()).isEqualTo("Bad input");
        assertThat(extractor.extract("{\"title\":\"Conflict\",\"status\":409}").getDetail()).isEqualTo("Conflict");
    }

    @Test
    void testExtract_jsonWithoutKnownMessage() {
        ErrorDetailExtractor.ErrorDetail detail = extractor.extract("{\"code\":7}");

        assertThat(detail.getDetail()).isEqualTo("{\"code\":7}");
        assertThat(detail.getStructuredError()).isNotNull();
    }

    @Test
    void testExtract_rawTextTruncated() {
        properties.getComposite().setErrorDetailMaxLength(5);

        ErrorDetailExtractor.ErrorDetail detail = extractor.extract("<html>Server Error</html>");

        assertThat(detail.getDetail()).isEqualTo("<html...");
        assertThat(detail.getStructuredError()).isNull();
    }

    @Test
    void testExtract_blankBody() {
        ErrorDetailExtractor.ErrorDetail detail = extractor.extract("  ");

        assertThat(detail.getDetail()).isNull();
        assertThat(detail.getStructuredError()).isNull();
    }
}
