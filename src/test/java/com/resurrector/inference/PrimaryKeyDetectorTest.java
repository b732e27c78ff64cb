package com.resurrector.inference;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PrimaryKeyDetectorTest {

    @Test
    void detect_shouldPreferExactId() {
        assertThat(PrimaryKeyDetector.detect("users", List.of("user_id", "id", "name"))).isEqualTo("id");
    }

    @Test
    void detect_shouldFallBackToUnderscoreId() {
        assertThat(PrimaryKeyDetector.detect("users", List.of("_id", "name"))).isEqualTo("_id");
    }

    @Test
    void detect_shouldMatchResourceScopedKeyBySingularName() {
        assertThat(PrimaryKeyDetector.detect("orders", List.of("order_id", "customer_id", "total")))
                .isEqualTo("order_id");
        assertThat(PrimaryKeyDetector.detect("customers", List.of("CustomerId", "Name"))).isEqualTo("CustomerId");
    }

    @Test
    void detect_shouldAcceptSingleIdLikeField() {
        assertThat(PrimaryKeyDetector.detect("products", List.of("sku_code", "title"))).isEqualTo("sku_code");
    }

    @Test
    void detect_shouldReturnDefaultWhenAmbiguousOrAbsent() {
        assertThat(PrimaryKeyDetector.detect("payments", List.of("customer_id", "invoice_id"))).isEqualTo("id");
        assertThat(PrimaryKeyDetector.detect("notes", List.of("title", "body"))).isEqualTo("id");
        assertThat(PrimaryKeyDetector.detect("notes", List.of())).isEqualTo("id");
    }

    @Test
    void detect_shouldMatchWholeTokensOnly() {
        assertThat(PrimaryKeyDetector.detect("accounts", List.of("provider", "name"))).isEqualTo("id");
        assertThat(PrimaryKeyDetector.detect("accounts", List.of("provider", "account_no"))).isEqualTo("account_no");
        assertThat(PrimaryKeyDetector.detect("addresses", List.of("zipcode", "street_code"))).isEqualTo("street_code");
        assertThat(PrimaryKeyDetector.detect("videos", List.of("video", "keyword", "guidance"))).isEqualTo("id");
    }
}
