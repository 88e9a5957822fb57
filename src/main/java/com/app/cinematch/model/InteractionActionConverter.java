package com.app.cinematch.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores actions as the lowercase codes the catalog application writes.
 */
@Converter(autoApply = true)
public class InteractionActionConverter implements AttributeConverter<InteractionAction, String> {

    @Override
    public String convertToDatabaseColumn(InteractionAction action) {
        return action != null ? action.getCode() : null;
    }

    @Override
    public InteractionAction convertToEntityAttribute(String code) {
        return code != null ? InteractionAction.fromCode(code) : null;
    }
}
