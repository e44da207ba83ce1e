package com.valkyrlabs.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link PrincipalType} as {@code user} / {@code group}. */
@Converter(autoApply = true)
public class PrincipalTypeConverter implements AttributeConverter<PrincipalType, String> {

    @Override
    public String convertToDatabaseColumn(PrincipalType attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public PrincipalType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : PrincipalType.fromValue(dbData);
    }
}
