package com.pluginroute.intercept;

import com.fasterxml.jackson.databind.JsonNode;
import com.pluginroute.common.infra.JsonFile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Locates a plugin directory by name.
 *
 * <p>
 * Search order, first hit wins:
 * <ol>
 * <li>{@code installPath} of a matching entry in {@code installed_plugins.json}</li>
 * <li>live copy {@code <root>/knowledge-work-plugins/<name>}</li>
 * <li>cached copy {@code <root>/cache/knowledge-work-plugins/<name>/<version>},
 * greatest version directory name by string order</li>
 * <li>{@code <root>/marketplaces/*}{@code /plugins/<name>} or
 * {@code /external_plugins/<name>}, in directory listing order</li>
 * </ol>
 */
@Slf4j
public final class PluginDirResolver {

    private PluginDirResolver() {
    }

    public static final String COLLECTION_DIRNAME = "knowledge-work-plugins";
    private static final String CACHE_DIRNAME = "cache";
    private static final String MARKETPLACES_DIRNAME = "marketplaces";
    private static final String MARKETPLACE_PLUGINS_DIRNAME = "plugins";
    private static final String MARKETPLACE_EXTERNAL_DIRNAME = "external_plugins";

    // =========================================================================
    // Lookup
    // =========================================================================

    /**
     * Find the directory of {@code pluginName} under {@code pluginsRoot}.
     *
     * @param pluginName           plugin to find
     * @param pluginsRoot          plugins root, usually {@code ~/.claude/plugins}
     * @param installedPluginsFile manifest of installed plugins; may be null
     * @return the plugin directory, or empty if no location has it or the name
     *         is not a valid path segment
     */
    public static Optional<Path> findPluginDir(String pluginName, Path pluginsRoot, Path installedPluginsFile) {
        try {
            return search(pluginName, pluginsRoot, installedPluginsFile);
        } catch (InvalidPathException e) {
            log.debug("Plugin name {} is not a valid path: {}", pluginName, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<Path> search(String pluginName, Path pluginsRoot, Path installedPluginsFile) {
        Optional<Path> installed = fromInstalledManifest(pluginName, installedPluginsFile);
        if (installed.isPresent())
            return installed;

        Path live = pluginsRoot.resolve(COLLECTION_DIRNAME).resolve(pluginName);
        if (Files.isDirectory(live)) {
            log.debug("Plugin {} resolved to live copy {}", pluginName, live);
            return Optional.of(live);
        }

        Optional<Path> cached = latestCachedVersion(
                pluginsRoot.resolve(CACHE_DIRNAME).resolve(COLLECTION_DIRNAME).resolve(pluginName));
        if (cached.isPresent()) {
            log.debug("Plugin {} resolved to cached copy {}", pluginName, cached.get());
            return cached;
        }

        Optional<Path> marketplace = fromMarketplaces(pluginName, pluginsRoot.resolve(MARKETPLACES_DIRNAME));
        if (marketplace.isPresent()) {
            log.debug("Plugin {} resolved to marketplace copy {}", pluginName, marketplace.get());
            return marketplace;
        }

        log.debug("Plugin {} not found under {}", pluginName, pluginsRoot);
        return Optional.empty();
    }

    // =========================================================================
    // Locations
    // =========================================================================

    static Optional<Path> fromInstalledManifest(String pluginName, Path installedPluginsFile) {
        JsonNode manifest = JsonFile.loadTree(installedPluginsFile);
        if (manifest == null || !manifest.isObject())
            return Optional.empty();

        Iterator<Map.Entry<String, JsonNode>> entries = manifest.fields();
        while (entries.hasNext()) {
            JsonNode entry = entries.next().getValue();
            if (!entry.isObject())
                continue;
            String name = entry.path("name").asText("");
            String installPath = entry.path("installPath").asText("");
            if (!name.equals(pluginName) || installPath.isEmpty())
                continue;
            Path candidate;
            try {
                candidate = Path.of(installPath);
            } catch (InvalidPathException e) {
                log.debug("Skipping manifest entry for {} with invalid installPath: {}", pluginName, e.getMessage());
                continue;
            }
            if (Files.isDirectory(candidate)) {
                log.debug("Plugin {} resolved from manifest to {}", pluginName, candidate);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Version directories compare as plain strings, so {@code 9.0.0} sorts above
     * {@code 10.0.0}.
     */
    static Optional<Path> latestCachedVersion(Path cacheParent) {
        if (!Files.isDirectory(cacheParent))
            return Optional.empty();

        List<Path> versions = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(cacheParent, Files::isDirectory)) {
            stream.forEach(versions::add);
        } catch (IOException e) {
            log.debug("Failed to list plugin cache {}: {}", cacheParent, e.getMessage());
            return Optional.empty();
        }
        return versions.stream()
                .max(Comparator.comparing((Path p) -> p.getFileName().toString()));
    }

    static Optional<Path> fromMarketplaces(String pluginName, Path marketplaces) {
        if (!Files.isDirectory(marketplaces))
            return Optional.empty();

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(marketplaces, Files::isDirectory)) {
            for (Path marketplace : stream) {
                Path candidate = marketplace.resolve(MARKETPLACE_PLUGINS_DIRNAME).resolve(pluginName);
                if (Files.isDirectory(candidate))
                    return Optional.of(candidate);
                candidate = marketplace.resolve(MARKETPLACE_EXTERNAL_DIRNAME).resolve(pluginName);
                if (Files.isDirectory(candidate))
                    return Optional.of(candidate);
            }
        } catch (IOException e) {
            log.debug("Failed to list marketplaces {}: {}", marketplaces, e.getMessage());
        }
        return Optional.empty();
    }
}
