package com.resurrector.inference;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NameFormatterTest {

    @Test
    void format_shouldTitleCaseSnakeAndCamelIdentifiers() {
        assertThat(NameFormatter.format("email_address")).isEqualTo("Email Address");
        assertThat(NameFormatter.format("createdAt")).isEqualTo("Created At");
        assertThat(NameFormatter.format("user-id")).isEqualTo("User Id");
        assertThat(NameFormatter.format("address.city")).isEqualTo("Address City");
    }

    @Test
    void format_shouldBeIdempotent() {
        String once = NameFormatter.format("billing_postal_code");
        assertThat(NameFormatter.format(once)).isEqualTo(once);
    }

    @Test
    void format_shouldNeverReturnAnEmptyLabel() {
        assertThat(NameFormatter.format("")).isEqualTo("Field");
        assertThat(NameFormatter.format("__")).isEqualTo("Field");
        assertThat(NameFormatter.format(null)).isEqualTo("Field");
    }

    @Test
    void words_shouldSplitBeforeUpperCaseAfterDigits() {
        assertThat(NameFormatter.words("address2Line")).containsExactly("address2", "Line");
    }
}
