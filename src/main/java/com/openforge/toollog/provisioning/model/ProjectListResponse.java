package com.openforge.toollog.provisioning.model;

import java.util.List;

/** Response from GET /projects. */
public record ProjectListResponse(
        List<RemoteProject> projects
) {

    public List<RemoteProject> projectsOrEmpty() {
        return projects == null ? List.of() : projects;
    }
}
