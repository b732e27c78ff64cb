package com.resurrector.inference;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceNamesTest {

    @Test
    void fromPath_shouldSkipPrefixesVersionsAndIds() {
        assertThat(ResourceNames.fromPath("/api/v1/users")).isEqualTo("users");
        assertThat(ResourceNames.fromPath("/api/v1/users/{user_id}")).isEqualTo("users");
        assertThat(ResourceNames.fromPath("/Orders/42?expand=lines")).isEqualTo("orders");
        assertThat(ResourceNames.fromPath("/users/:id/posts")).isEqualTo("posts");
        assertThat(ResourceNames.fromPath("/api/v2/")).isNull();
    }

    @Test
    void isItemScoped_shouldOnlyLookAtLastSegment() {
        assertThat(ResourceNames.isItemScoped("/users/{id}")).isTrue();
        assertThat(ResourceNames.isItemScoped("/users/123/")).isTrue();
        assertThat(ResourceNames.isItemScoped("/users/3f2504e0-4f89-11d3-9a0c-0305e82c3301")).isTrue();
        assertThat(ResourceNames.isItemScoped("/users/{id}/posts")).isFalse();
        assertThat(ResourceNames.isItemScoped("/users")).isFalse();
    }

    @Test
    void collectionPath_shouldStripTrailingIdentifiers() {
        assertThat(ResourceNames.collectionPath("/users/{id}")).isEqualTo("/users");
        assertThat(ResourceNames.collectionPath("/users/{id}/posts")).isEqualTo("/users/{id}/posts");
        assertThat(ResourceNames.collectionPath("/{id}")).isEqualTo("/");
    }

    @Test
    void singularizeAndPluralize_shouldHandleCommonEndings() {
        assertThat(ResourceNames.singularize("categories")).isEqualTo("category");
        assertThat(ResourceNames.singularize("addresses")).isEqualTo("address");
        assertThat(ResourceNames.singularize("orders")).isEqualTo("order");
        assertThat(ResourceNames.pluralize("category")).isEqualTo("categories");
        assertThat(ResourceNames.pluralize("day")).isEqualTo("days");
        assertThat(ResourceNames.pluralize("box")).isEqualTo("boxes");
        assertThat(ResourceNames.pluralize("users")).isEqualTo("users");
    }

    @Test
    void fromOperationName_shouldStripVerbAndMessageSuffix() {
        assertThat(ResourceNames.fromOperationName("GetCustomers")).isEqualTo("customers");
        assertThat(ResourceNames.fromOperationName("GetAllCustomers")).isEqualTo("customers");
        assertThat(ResourceNames.fromOperationName("CreateOrderRequest")).isEqualTo("orders");
        assertThat(ResourceNames.fromOperationName("GetCustomerOrders")).isEqualTo("customer_orders");
        assertThat(ResourceNames.fromOperationName(" ")).isEqualTo("resources");
    }
}
