package com.openforge.toollog.provisioning.model;

/** Response from POST /projects: { "project": { ... }, "connection_uris": [ ... ] }. */
public record ProjectResponse(
        RemoteProject project
) {}
