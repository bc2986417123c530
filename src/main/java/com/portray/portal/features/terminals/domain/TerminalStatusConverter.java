package com.portray.portal.features.terminals.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class TerminalStatusConverter implements AttributeConverter<TerminalStatus, String> {

    @Override
    public String convertToDatabaseColumn(TerminalStatus status) {
        return status == null ? null : status.getLabel();
    }

    @Override
    public TerminalStatus convertToEntityAttribute(String value) {
        return value == null ? null : TerminalStatus.fromLabel(value);
    }
}
