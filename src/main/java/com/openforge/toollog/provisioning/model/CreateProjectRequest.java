package com.openforge.toollog.provisioning.model;

/**
 * Request body for POST /projects.
 *
 * Wire format:
 * { "project": { "name": "db-3f2a9c0d1e4b5a6c" } }
 */
public record CreateProjectRequest(
        ProjectSpec project
) {

    public record ProjectSpec(String name) {}

    public static CreateProjectRequest named(String name) {
        return new CreateProjectRequest(new ProjectSpec(name));
    }
}
