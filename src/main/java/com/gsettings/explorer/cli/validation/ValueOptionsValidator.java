package com.gsettings.explorer.cli.validation;

import com.gsettings.explorer.ExplorerConfig;
import com.gsettings.explorer.cli.exception.OptionsValidationException;
import com.gsettings.explorer.cli.model.ValidatedValueOptions;
import com.gsettings.explorer.cli.model.ValueOptions;
import com.gsettings.explorer.exception.ValueTreeException;
import com.gsettings.explorer.model.KeyMetadata;
import com.gsettings.explorer.model.ValueRange;
import com.gsettings.explorer.signature.TypeKind;
import com.gsettings.explorer.signature.TypeSignature;
import com.gsettings.explorer.value.GValue;
import com.gsettings.explorer.value.ScalarValue;
import com.gsettings.explorer.value.text.ValueTextParser;

import java.util.ArrayList;
import java.util.List;

public class ValueOptionsValidator {

    public ValidatedValueOptions validate(ValueOptions o) {
        List<String> errors = new ArrayList<>();

        TypeSignature signature = null;
        if (isBlank(o.getType())) {
            errors.add("Type signature is required (--type / -t).");
        } else {
            try {
                signature = TypeSignature.parse(o.getType());
            } catch (ValueTreeException e) {
                errors.add("Invalid --type: " + e.getMessage());
            }
        }

        GValue value = null;
        GValue defaultValue = null;
        ValueRange range = ValueRange.none();
        if (signature != null) {
            value = parseValue("--value", signature, o.getValue(), errors);
            defaultValue = parseValue("--default", signature, o.getDefaultValue(), errors);
            range = buildRange(signature, o, errors);
        }

        if (isBlank(o.getSchemaId())) {
            errors.add("Schema id must not be blank (--schema).");
        }
        if (isBlank(o.getKeyName())) {
            errors.add("Key name must not be blank (--key / -k).");
        }
        if (o.getRelocationPath() != null && !o.getRelocationPath().startsWith("/")) {
            errors.add("Relocation path must start with '/'. Got: " + o.getRelocationPath());
        }
        if (o.getIndentWidth() < 0) {
            errors.add("Indent width must not be negative. Got: " + o.getIndentWidth());
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        KeyMetadata key = KeyMetadata.builder()
                .schemaId(o.getSchemaId())
                .keyName(o.getKeyName())
                .type(o.getType())
                .defaultValue(defaultValue)
                .range(range)
                .summary(o.getSummary())
                .description(o.getDescription())
                .writable(!o.isReadOnly())
                .build();
        ExplorerConfig config = ExplorerConfig.builder()
                .relocationPath(o.getRelocationPath())
                .indentWidth(o.getIndentWidth())
                .showTypes(!o.isNoTypes())
                .maxValueLength(o.getMaxValueLength())
                .build();
        return new ValidatedValueOptions(key, value, config);
    }

    private GValue parseValue(String option, TypeSignature signature, String text, List<String> errors) {
        if (text == null) {
            return null;
        }
        try {
            return ValueTextParser.parse(signature, text);
        } catch (ValueTreeException e) {
            errors.add("Invalid " + option + ": " + e.getMessage());
            return null;
        }
    }

    private ValueRange buildRange(TypeSignature signature, ValueOptions o, List<String> errors) {
        boolean hasBounds = o.getRangeMin() != null || o.getRangeMax() != null;
        boolean hasChoices = !o.getChoices().isEmpty();

        if (hasBounds && hasChoices) {
            errors.add("--range-min/--range-max and --choice cannot be combined.");
            return ValueRange.none();
        }
        if (hasBounds) {
            if (o.getRangeMin() == null || o.getRangeMax() == null) {
                errors.add("--range-min and --range-max must be given together.");
                return ValueRange.none();
            }
            if (!signature.isLeaf() || !(signature.getKind().isInteger() || signature.is(TypeKind.DOUBLE))) {
                errors.add("A range needs a numeric type. Got: " + signature);
                return ValueRange.none();
            }
            GValue min = parseValue("--range-min", signature, o.getRangeMin(), errors);
            GValue max = parseValue("--range-max", signature, o.getRangeMax(), errors);
            if (min == null || max == null) {
                return ValueRange.none();
            }
            try {
                return ValueRange.between((ScalarValue) min, (ScalarValue) max);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
                return ValueRange.none();
            }
        }
        if (hasChoices) {
            if (signature.is(TypeKind.STRING)) {
                return ValueRange.choices(o.getChoices());
            }
            if (signature.is(TypeKind.ARRAY) && signature.elementSignature().is(TypeKind.STRING)) {
                return ValueRange.flags(o.getChoices());
            }
            errors.add("Choices need type 's' or 'as'. Got: " + signature);
        }
        return ValueRange.none();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
