package com.outreach.scoring.service;

import com.outreach.scoring.config.BulkUpdateProperties;
import com.outreach.scoring.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Name-safety checks for list identifiers (file names) before they are used to look anything up.
 */
@Component
public class IdentifierValidator {

    private final BulkUpdateProperties properties;

    public IdentifierValidator(BulkUpdateProperties properties) {
        this.properties = properties;
    }

    /**
     * @param field path of the identifier in the request, used in the error
     * @return the identifier unchanged
     * @throws ValidationException naming the field and the failed check
     */
    public String validate(Object identifier, String field) {
        if (!(identifier instanceof String filename)) {
            throw new ValidationException(field, "Invalid filename type: "
                    + (identifier == null ? "null" : identifier.getClass().getSimpleName()));
        }
        if (filename.isBlank()) {
            throw new ValidationException(field, "Invalid filename '': must not be empty");
        }
        if (filename.length() > properties.getMaxIdentifierLength()) {
            throw invalid(field, filename, "Filename too long: " + filename.length()
                    + " > " + properties.getMaxIdentifierLength());
        }
        if (filename.contains("..") || filename.contains("/") || filename.contains("\\")) {
            throw invalid(field, filename, "Path traversal attempt detected in filename: " + filename);
        }
        for (String dangerous : properties.getForbiddenCharacters()) {
            if (filename.contains(dangerous)) {
                throw invalid(field, filename, "Dangerous character '" + printable(dangerous)
                        + "' in filename: " + filename);
            }
        }
        String extension = extensionOf(filename);
        if (extension != null && !properties.getAllowedExtensions().contains(extension)) {
            throw invalid(field, filename, "Invalid file extension: " + extension);
        }
        return filename;
    }

    /**
     * Lower-cased suffix from the last dot, or null when the name has none (a leading dot does not count).
     */
    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) {
            return null;
        }
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static ValidationException invalid(String field, String filename, String reason) {
        return new ValidationException(field, "Invalid filename '" + filename + "': " + reason);
    }

    private static String printable(String character) {
        return character.replace("\n", "\\n").replace("\r", "\\r");
    }
}
