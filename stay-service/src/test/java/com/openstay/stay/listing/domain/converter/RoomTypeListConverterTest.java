package com.openstay.stay.listing.domain.converter;

import com.openstay.stay.listing.domain.model.RoomType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomTypeListConverterTest {

    private final RoomTypeListConverter converter = new RoomTypeListConverter();

    @Test
    @DisplayName("room collection is written as an ordered JSON array using the isAC field name")
    void convertToDatabaseColumn_writesJsonArray() {
        String json = converter.convertToDatabaseColumn(List.of(
                new RoomType("Single", 2, 1, 500000, 100000, true)));

        assertThat(json).startsWith("[{").endsWith("}]")
                .contains("\"type\":\"Single\"", "\"totalCount\":2", "\"available\":1",
                        "\"priceMinor\":500000", "\"depositMinor\":100000", "\"isAC\":true")
                .doesNotContain("airConditioned");
    }

    @Test
    @DisplayName("stored documents are read back in order")
    void convertToEntityAttribute_readsInOrder() {
        List<RoomType> rooms = converter.convertToEntityAttribute(
                "[{\"type\":\"Double\",\"totalCount\":1,\"available\":0,\"priceMinor\":1,\"depositMinor\":0,\"isAC\":false},"
                        + "{\"type\":\"Single\",\"totalCount\":3,\"available\":3,\"priceMinor\":2,\"depositMinor\":0,\"isAC\":true}]");

        assertThat(rooms).extracting(RoomType::type).containsExactly("Double", "Single");
        assertThat(rooms.get(1).airConditioned()).isTrue();
    }

    @Test
    @DisplayName("blank column is an empty collection; a document breaking the capacity invariant is refused")
    void convertToEntityAttribute_edgeCases() {
        assertThat(converter.convertToEntityAttribute(null)).isEmpty();
        assertThat(converter.convertToEntityAttribute("")).isEmpty();
        assertThatThrownBy(() -> converter.convertToEntityAttribute(
                "[{\"type\":\"Single\",\"totalCount\":1,\"available\":2,\"priceMinor\":1,\"depositMinor\":0,\"isAC\":false}]"))
                .isInstanceOf(RuntimeException.class);
    }
}
