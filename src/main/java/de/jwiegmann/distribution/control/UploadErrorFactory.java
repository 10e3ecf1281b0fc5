package de.jwiegmann.distribution.control;

import de.jwiegmann.distribution.boundary.dto.error.UploadError;

import java.util.List;
import java.util.Map;

/**
 * Zentrale Stelle für alle Fehlercodes der Upload-Pipeline.
 */
public final class UploadErrorFactory {

    private UploadErrorFactory() {
    }

    // --- Ingestion ---

    public static UploadError noFile() {
        return UploadError.builder()
                .code("NO_FILE")
                .message("No file was uploaded")
                .build();
    }

    public static UploadError emptyFile() {
        return UploadError.builder()
                .code("EMPTY_FILE")
                .message("The uploaded file is empty or contains no data")
                .build();
    }

    public static UploadError fileTooLarge(long maxBytes) {
        return UploadError.builder()
                .code("FILE_TOO_LARGE")
                .message("File size exceeds " + (maxBytes / (1024 * 1024)) + "MB limit")
                .details(Map.of("maxBytes", maxBytes))
                .build();
    }

    public static UploadError invalidFileType(String contentType, String filename) {
        return UploadError.builder()
                .code("INVALID_FILE_TYPE")
                .message("Invalid file type. Only CSV, XLSX, and XLS files are allowed.")
                .details(Map.of(
                        "contentType", String.valueOf(contentType),
                        "filename", String.valueOf(filename)))
                .build();
    }

    public static UploadError invalidFileSignature(String format) {
        return UploadError.builder()
                .code("INVALID_FILE_SIGNATURE")
                .message("File content does not match the declared file type")
                .details(Map.of("format", format))
                .build();
    }

    public static UploadError invalidFilename(String reason) {
        return UploadError.builder()
                .code("INVALID_FILENAME")
                .message("Invalid filename. " + reason)
                .build();
    }

    // --- Parsing ---

    public static UploadError unsupportedFormat() {
        return UploadError.builder()
                .code("UNSUPPORTED_FORMAT")
                .message("Unsupported file format. Only CSV, XLSX, and XLS files are supported.")
                .build();
    }

    public static UploadError noWorksheets() {
        return UploadError.builder()
                .code("NO_WORKSHEETS")
                .message("No worksheets found in the Excel file")
                .build();
    }

    public static UploadError emptyWorksheet() {
        return UploadError.builder()
                .code("EMPTY_WORKSHEET")
                .message("The worksheet is empty or contains no data")
                .build();
    }

    public static UploadError csvParseError(String details) {
        return UploadError.builder()
                .code("CSV_PARSE_ERROR")
                .message("Error parsing CSV file")
                .details(Map.of("details", String.valueOf(details)))
                .build();
    }

    public static UploadError excelParseError(String details) {
        return UploadError.builder()
                .code("EXCEL_PARSE_ERROR")
                .message("Error parsing Excel file")
                .details(Map.of("details", String.valueOf(details)))
                .build();
    }

    public static UploadError missingColumns(List<String> missing, List<String> available, List<String> required) {
        return UploadError.builder()
                .code("MISSING_COLUMNS")
                .message("Missing required columns: " + String.join(", ", missing))
                .details(Map.of(
                        "missingColumns", missing,
                        "availableColumns", available,
                        "requiredColumns", required))
                .build();
    }

    // --- Validierung ---

    public static UploadError invalidData(List<String> errors, int totalRows, int validRows) {
        return UploadError.builder()
                .code("INVALID_DATA")
                .message("Some rows contain invalid data")
                .details(Map.of(
                        "errors", errors,
                        "totalRows", totalRows,
                        "validRows", validRows))
                .build();
    }

    // --- Verteilung ---

    public static UploadError noActiveAgents() {
        return UploadError.builder()
                .code("NO_ACTIVE_AGENTS")
                .message("No active agents available for distribution")
                .build();
    }

    public static UploadError invalidTargetAgentCount(Object value, int maxAgents) {
        return UploadError.builder()
                .code("INVALID_TARGET_AGENT_COUNT")
                .message("Target agent count must be an integer between 1 and " + maxAgents)
                .details(Map.of("targetAgentCount", String.valueOf(value), "maxAgents", maxAgents))
                .build();
    }

    // --- Abfragen / Allgemein ---

    public static UploadError notFound(String what) {
        return UploadError.builder()
                .code("NOT_FOUND")
                .message(what + " not found")
                .build();
    }

    public static UploadError forbidden(String distributionId) {
        return UploadError.builder()
                .code("FORBIDDEN")
                .message("Access denied to this distribution")
                .details(Map.of("distributionId", distributionId))
                .build();
    }

    public static UploadError invalidParameter(String name, String value) {
        return UploadError.builder()
                .code("INVALID_PARAMETER")
                .message("Invalid value for parameter '" + name + "'")
                .details(Map.of("parameter", name, "value", String.valueOf(value)))
                .build();
    }

    public static UploadError internalError(String message) {
        return UploadError.builder()
                .code("INTERNAL_ERROR")
                .message(message)
                .build();
    }

    public static UploadError distributionFailed(String distributionId) {
        return UploadError.builder()
                .code("INTERNAL_ERROR")
                .message("An unexpected error occurred while processing the file")
                .details(Map.of("distributionId", distributionId))
                .build();
    }
}
