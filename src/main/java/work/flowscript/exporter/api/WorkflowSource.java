package work.flowscript.exporter.api;

import java.net.URI;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Location of a workflow document: exactly one of a local path or an HTTP(S) URL.
 */
public record WorkflowSource(Optional<Path> localPath, Optional<URI> remoteUri) {
    public WorkflowSource {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(remoteUri, "remoteUri");
        if (localPath.isPresent() == remoteUri.isPresent()) {
            throw new IllegalArgumentException("Exactly one of a local path or a remote URL is required");
        }
        remoteUri.ifPresent(uri -> {
            var scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new IllegalArgumentException("Only http and https workflow URLs are supported: " + uri);
            }
        });
    }

    /**
     * Command-line form: {@code http://} and {@code https://} arguments are URLs, anything else
     * is a path.
     */
    public static WorkflowSource parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        var trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Workflow location must not be blank");
        }
        var lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return forRemote(URI.create(trimmed));
        }
        return forLocal(Path.of(trimmed));
    }

    public static WorkflowSource forLocal(Path path) {
        return new WorkflowSource(Optional.of(path), Optional.empty());
    }

    public static WorkflowSource forRemote(URI uri) {
        return new WorkflowSource(Optional.empty(), Optional.of(uri));
    }

    public boolean isRemote() {
        return remoteUri.isPresent();
    }

    public String display() {
        return remoteUri.map(URI::toString).orElseGet(() -> localPath.orElseThrow().toString());
    }
}
