package org.strata.cli.service;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.nio.file.Path;

/**
 * Effective settings after merging CLI options over the active profile.
 */
@Value
@Builder
public class ConnectionSettings {
    String url;
    String user;
    @ToString.Exclude String password;
    String dialect;
    Path unitsDirectory;
}
