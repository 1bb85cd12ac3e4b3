package io.github.nabilcarel.gateway;

import io.github.nabilcarel.gateway.util.PathSegments;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PathSegmentsTest {

    @Test
    void testOrdinaryPathsAreSafe() {
        assertThat(PathSegments.isSafeRelativePath(null)).isTrue();
        assertThat(PathSegments.isSafeRelativePath("")).isTrue();
        assertThat(PathSegments.isSafeRelativePath("Active/Top")).isTrue();
        assertThat(PathSegments.isSafeRelativePath("Customers('C1')/Orders")).isTrue();
        assertThat(PathSegments.isSafeRelativePath("v1.0/file..txt")).isTrue();
        assertThat(PathSegments.isSafeRelativePath("50%25off")).isTrue();
        assertThat(PathSegments.isSafeRelativePath("a%zz")).isTrue();
    }

    @Test
    void testLiteralDotSegmentsAreRejected() {
        assertThat(PathSegments.isSafeRelativePath("../OrderLines/1")).isFalse();
        assertThat(PathSegments.isSafeRelativePath("a/../../OrderLines")).isFalse();
        assertThat(PathSegments.isSafeRelativePath("./x")).isFalse();
        assertThat(PathSegments.isSafeRelativePath("x/..")).isFalse();
        assertThat(PathSegments.isSafeRelativePath("a\\..\\OrderLines")).isFalse();
    }

    @Test
    void testEncodedDotSegmentsAreRejected() {
        assertThat(PathSegments.isSafeRelativePath("%2e%2e/OrderLines/1")).isFalse();
        assertThat(PathSegments.isSafeRelativePath("%2E%2E/OrderLines/1")).isFalse();
        assertThat(PathSegments.isSafeRelativePath(".%2e/OrderLines")).isFalse();
        assertThat(PathSegments.isSafeRelativePath("a%2f..%2fOrderLines")).isFalse();
        assertThat(PathSegments.isSafeRelativePath("a%5c..%5cOrderLines")).isFalse();
    }

    @Test
    void testDoubleEncodedDotSegmentsAreRejected() {
        assertThat(PathSegments.isSafeRelativePath("%252e%252e/OrderLines")).isFalse();
        assertThat(PathSegments.isSafeRelativePath("a%zz/%2e%2e/b")).isFalse();
    }
}
