package com.openforge.toollog.provisioning.model;

/**
 * A project (one isolated Postgres instance) as returned by the control plane.
 *
 * Wire format:
 * { "id": "twilight-river-123456", "name": "db-3f2a9c0d1e4b5a6c", "region_id": "aws-us-east-2" }
 */
public record RemoteProject(
        String id,
        String name,
        String regionId
) {}
