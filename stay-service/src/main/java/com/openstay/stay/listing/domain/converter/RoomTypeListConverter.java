package com.openstay.stay.listing.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.openstay.stay.listing.domain.model.RoomType;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class RoomTypeListConverter extends JsonListConverter<RoomType> {

    public RoomTypeListConverter() {
        super(new TypeReference<List<RoomType>>() {
        });
    }
}
