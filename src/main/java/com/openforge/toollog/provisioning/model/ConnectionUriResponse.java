package com.openforge.toollog.provisioning.model;

/**
 * Response from GET /projects/{id}/connection_uri.
 *
 * Wire format: { "uri": "postgres://..." }. Older gateways answer with
 * { "connection_uri": "postgres://..." }, so both are accepted.
 */
public record ConnectionUriResponse(
        String uri,
        String connectionUri
) {

    public String value() {
        if (uri != null && !uri.isBlank()) return uri;
        return connectionUri;
    }
}
