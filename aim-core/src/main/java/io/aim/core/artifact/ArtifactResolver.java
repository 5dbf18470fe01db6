package io.aim.core.artifact;

import io.aim.core.exception.ArtifactUnavailableException;

/// Turns an {@link Artifact} into bytes.
///
/// Called once per request, on the submitting thread, before validation.
///
/// @see DefaultArtifactResolver
@FunctionalInterface
public interface ArtifactResolver {

    /// Resolves the artifact.
    ///
    /// @param artifact the submitted artifact, not null
    /// @return the resolved bytes and mime type, never null
    /// @throws ArtifactUnavailableException if the artifact cannot be obtained
    ResolvedArtifact resolve(Artifact artifact) throws ArtifactUnavailableException;
}
