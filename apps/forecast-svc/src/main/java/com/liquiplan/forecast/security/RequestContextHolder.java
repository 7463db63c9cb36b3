package com.liquiplan.forecast.security;

import java.util.Optional;

/**
 * Per-request context bound to the servlet thread by {@link TraceIdFilter}.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static void clear() {
        CONTEXT.remove();
    }

    public record RequestContext(String traceId) {

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private String traceId;

            public Builder traceId(String traceId) {
                this.traceId = traceId;
                return this;
            }

            public RequestContext build() {
                return new RequestContext(traceId);
            }
        }
    }
}
