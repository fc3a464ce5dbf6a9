package org.zhelev.avroconsumer;

/**
 * The schema registry could not supply a codec for a schema id.
 */
public class SchemaResolutionException extends AvroConsumerException {

    public static final int NO_ERROR_CODE = -1;

    private final int schemaId;

    private final int errorCode;

    private final int httpStatus;

    public SchemaResolutionException(String message, int schemaId) {
        this(message, null, schemaId, NO_ERROR_CODE, NO_ERROR_CODE);
    }

    public SchemaResolutionException(String message, Throwable cause, int schemaId) {
        this(message, cause, schemaId, NO_ERROR_CODE, NO_ERROR_CODE);
    }

    public SchemaResolutionException(String message, Throwable cause, int schemaId, int errorCode, int httpStatus) {
        super(message, cause);
        this.schemaId = schemaId;
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public int getSchemaId() {
        return schemaId;
    }

    /**
     * @return the registry's {@code error_code}, e.g. 40403 for an unknown schema, or {@link #NO_ERROR_CODE}
     */
    public int getErrorCode() {
        return errorCode;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

}
