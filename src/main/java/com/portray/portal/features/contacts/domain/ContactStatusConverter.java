package com.portray.portal.features.contacts.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ContactStatusConverter implements AttributeConverter<ContactStatus, String> {

    @Override
    public String convertToDatabaseColumn(ContactStatus status) {
        return status == null ? null : status.getLabel();
    }

    @Override
    public ContactStatus convertToEntityAttribute(String value) {
        return value == null ? null : ContactStatus.fromLabel(value);
    }
}
