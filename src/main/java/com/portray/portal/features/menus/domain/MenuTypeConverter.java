package com.portray.portal.features.menus.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class MenuTypeConverter implements AttributeConverter<MenuType, String> {

    @Override
    public String convertToDatabaseColumn(MenuType type) {
        return type == null ? null : type.getLabel();
    }

    @Override
    public MenuType convertToEntityAttribute(String value) {
        return value == null ? null : MenuType.fromLabel(value);
    }
}
