package com.valkyrlabs.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link AclPermission} as {@code read} / {@code write}. */
@Converter(autoApply = true)
public class AclPermissionConverter implements AttributeConverter<AclPermission, String> {

    @Override
    public String convertToDatabaseColumn(AclPermission attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public AclPermission convertToEntityAttribute(String dbData) {
        return dbData == null ? null : AclPermission.fromValue(dbData);
    }
}
