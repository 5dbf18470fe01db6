package io.aim.core.artifact;

import io.aim.core.exception.ArtifactUnavailableException;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Locale;
import java.util.logging.Logger;

/// Resolves inline artifacts, `data:` URLs and, when an artifact root is
/// configured, local files below that root.
///
/// ### Supported locators
/// - `data:image/png;base64,...` - decoded in place
/// - `file:///root/shots/shot.png` - read from disk, root required
/// - plain filesystem paths - read from disk, root required
///
/// File locators are resolved against the artifact root and must stay inside
/// it after normalization and symlink resolution. Without a root every file
/// locator is rejected. Failures never reveal whether a path exists.
///
/// The mime type of a file is derived from its extension (`.png`, `.jpg`,
/// `.jpeg`), falling back to {@link Files#probeContentType(Path)}.
public class DefaultArtifactResolver implements ArtifactResolver {

    private static final Logger logger = Logger.getLogger(DefaultArtifactResolver.class.getName());

    static final String UNKNOWN_MIME_TYPE = "application/octet-stream";
    static final String FILE_UNAVAILABLE = "Artifact file is not available";
    private static final String DATA_PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64,";

    private final Path artifactRoot;
    private final long maxBytes;

    /// Creates a resolver accepting inline artifacts and `data:` URLs only.
    public DefaultArtifactResolver() {
        this(null, Long.MAX_VALUE);
    }

    /// @param artifactRoot directory file locators are confined to, or null to reject file locators
    /// @param maxBytes largest file the resolver reads, must be positive
    public DefaultArtifactResolver(Path artifactRoot, long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        this.artifactRoot = artifactRoot != null ? artifactRoot.toAbsolutePath().normalize() : null;
        this.maxBytes = maxBytes;
    }

    @Override
    public ResolvedArtifact resolve(Artifact artifact) throws ArtifactUnavailableException {
        if (artifact instanceof Artifact.Inline inline) {
            return new ResolvedArtifact(inline.bytes(), inline.mimeType());
        }
        String uri = ((Artifact.Locator) artifact).uri();
        if (uri.isBlank()) {
            throw new ArtifactUnavailableException("Artifact locator is blank");
        }
        if (uri.regionMatches(true, 0, DATA_PREFIX, 0, DATA_PREFIX.length())) {
            return decodeDataUrl(uri);
        }
        if (artifactRoot == null) {
            throw new ArtifactUnavailableException("File artifact locators are not enabled");
        }
        return readFile(confine(toPath(uri)));
    }

    private ResolvedArtifact decodeDataUrl(String uri) throws ArtifactUnavailableException {
        int marker = uri.indexOf(BASE64_MARKER);
        if (marker < 0) {
            throw new ArtifactUnavailableException("Only base64 data URLs are supported");
        }
        String mimeType = uri.substring(DATA_PREFIX.length(), marker).toLowerCase(Locale.ROOT);
        try {
            byte[] bytes = Base64.getDecoder().decode(uri.substring(marker + BASE64_MARKER.length()));
            return new ResolvedArtifact(bytes, mimeType.isEmpty() ? UNKNOWN_MIME_TYPE : mimeType);
        } catch (IllegalArgumentException e) {
            throw new ArtifactUnavailableException("Malformed base64 payload in data URL", e);
        }
    }

    // InvalidPathException is an IllegalArgumentException
    private Path toPath(String uri) throws ArtifactUnavailableException {
        try {
            if (uri.startsWith("file:")) {
                return Path.of(URI.create(uri));
            }
            return Path.of(uri);
        } catch (IllegalArgumentException e) {
            throw new ArtifactUnavailableException("Invalid artifact locator", e);
        }
    }

    private Path confine(Path requested) throws ArtifactUnavailableException {
        Path candidate = artifactRoot.resolve(requested).normalize();
        if (!candidate.startsWith(artifactRoot)) {
            logger.warning("Artifact locator outside artifact root rejected");
            throw new ArtifactUnavailableException(FILE_UNAVAILABLE);
        }
        try {
            Path real = candidate.toRealPath();
            if (!real.startsWith(artifactRoot.toRealPath())) {
                logger.warning("Artifact locator escaping artifact root through a link rejected");
                throw new ArtifactUnavailableException(FILE_UNAVAILABLE);
            }
            return real;
        } catch (IOException e) {
            throw new ArtifactUnavailableException(FILE_UNAVAILABLE, e);
        }
    }

    private ResolvedArtifact readFile(Path path) throws ArtifactUnavailableException {
        try {
            if (!Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)) {
                throw new ArtifactUnavailableException(FILE_UNAVAILABLE);
            }
            long size = Files.size(path);
            if (size > maxBytes) {
                throw new ArtifactUnavailableException(
                        "Artifact is " + size + " bytes, exceeding the limit of " + maxBytes + " bytes");
            }
            byte[] bytes = Files.readAllBytes(path);
            logger.fine("Read artifact " + path.getFileName() + " (" + bytes.length + " bytes)");
            return new ResolvedArtifact(bytes, mimeTypeOf(path));
        } catch (IOException e) {
            throw new ArtifactUnavailableException(FILE_UNAVAILABLE, e);
        }
    }

    static String mimeTypeOf(Path path) throws IOException {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".png")) {
            return "image/png";
        }
        if (name.endsWith(".jpg") || name.endsWith(".jpeg")) {
            return "image/jpeg";
        }
        String probed = Files.probeContentType(path);
        return probed != null ? probed : UNKNOWN_MIME_TYPE;
    }
}
