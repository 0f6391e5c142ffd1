package com.togomq.client.errors;

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;

/**
 * Translates transport failures into {@link TogoMQException}s.
 */
public final class GrpcErrors {

    private GrpcErrors() {
    }

    /**
     * Wraps {@code error} with {@code context}. gRPC statuses found on the cause
     * chain are classified by code; anything else is a stream error.
     *
     * @param error   the failure, may be null
     * @param context what the client was doing when it failed
     * @return the translated exception, or null if {@code error} is null
     */
    public static TogoMQException wrap(Throwable error, String context) {
        if (error == null) {
            return null;
        }
        Status status = findStatus(error);
        if (status == null) {
            return new TogoMQException(ErrorCode.STREAM, context, error);
        }
        String description = status.getDescription() == null ? "" : status.getDescription();
        return new TogoMQException(classify(status.getCode()), context + ": " + description, error);
    }

    /**
     * @param code a gRPC status code
     * @return the category reported for it
     */
    public static ErrorCode classify(Status.Code code) {
        switch (code) {
            case UNAUTHENTICATED:
                return ErrorCode.AUTH;
            case INVALID_ARGUMENT:
                return ErrorCode.VALIDATION;
            case UNAVAILABLE:
                return ErrorCode.CONNECTION;
            default:
                return ErrorCode.STREAM;
        }
    }

    private static Status findStatus(Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof StatusRuntimeException) {
                return ((StatusRuntimeException) t).getStatus();
            }
            if (t instanceof StatusException) {
                return ((StatusException) t).getStatus();
            }
            if (t.getCause() == t) {
                break;
            }
            t = t.getCause();
        }
        return null;
    }
}
