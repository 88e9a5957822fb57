package com.app.cinematch.model;

import com.app.cinematch.exception.InconsistentDataException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Maps the JSON genre array of {@code movie_metadata.genres} to a list of names.
 */
@Converter
public class GenreListConverter implements AttributeConverter<List<String>, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> GENRE_LIST = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<String> genres) {
        if (genres == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(genres);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize genres " + genres, e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank() || "null".equals(json.trim())) {
            return List.of();
        }
        try {
            return OBJECT_MAPPER.readValue(json, GENRE_LIST);
        } catch (JsonProcessingException e) {
            throw new InconsistentDataException("Unreadable genre list: " + json);
        }
    }
}
