package dev.dapbridge.client;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Launch arguments understood by the Godot editor's debug adapter.
 */
public final class GodotLaunchConfig {

    public static final String PROJECT_FILE = "project.godot";

    /** Which scene Godot starts. */
    public enum SceneMode {
        MAIN, CURRENT, CUSTOM
    }

    public enum Platform {
        HOST, ANDROID, WEB;

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final String project;
    private final SceneMode scene;
    private final String scenePath;
    private final Platform platform;
    private final boolean noDebug;
    private final boolean profiling;
    private final boolean debugCollisions;
    private final boolean debugPaths;
    private final boolean debugNavigation;
    private final String additionalOptions;

    private GodotLaunchConfig(Builder builder) {
        this.project = builder.project;
        this.scene = builder.scene;
        this.scenePath = builder.scenePath;
        this.platform = builder.platform == null ? Platform.HOST : builder.platform;
        this.noDebug = builder.noDebug;
        this.profiling = builder.profiling;
        this.debugCollisions = builder.debugCollisions;
        this.debugPaths = builder.debugPaths;
        this.debugNavigation = builder.debugNavigation;
        this.additionalOptions = builder.additionalOptions;
    }

    public static Builder mainScene(String project) {
        return new Builder(project, SceneMode.MAIN, null);
    }

    public static Builder currentScene(String project) {
        return new Builder(project, SceneMode.CURRENT, null);
    }

    public static Builder customScene(String project, String scenePath) {
        return new Builder(project, SceneMode.CUSTOM, scenePath);
    }

    public String project() {
        return project;
    }

    public SceneMode scene() {
        return scene;
    }

    public String scenePath() {
        return scenePath;
    }

    public Platform platform() {
        return platform;
    }

    /**
     * Checks that the project directory contains {@value #PROJECT_FILE} and that a custom scene names
     * its path.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public void validate() {
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("project path is required");
        }
        if (!Files.isRegularFile(Path.of(project).resolve(PROJECT_FILE))) {
            throw new IllegalArgumentException(PROJECT_FILE + " not found in " + project);
        }
        if (scene == SceneMode.CUSTOM && (scenePath == null || scenePath.isBlank())) {
            throw new IllegalArgumentException("scene path is required when using custom scene launch mode");
        }
    }

    /** Arguments of the DAP {@code launch} request. */
    public Map<String, Object> toLaunchArguments() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("project", project);
        args.put("scene", switch (scene) {
            case MAIN -> "main";
            case CURRENT -> "current";
            case CUSTOM -> scenePath;
        });
        args.put("platform", platform.value());
        args.put("noDebug", noDebug);
        args.put("profiling", profiling);
        args.put("debug_collisions", debugCollisions);
        args.put("debug_paths", debugPaths);
        args.put("debug_navigation", debugNavigation);
        if (additionalOptions != null && !additionalOptions.isBlank()) {
            args.put("additional_options", additionalOptions);
        }
        return args;
    }

    public static final class Builder {

        private final String project;
        private final SceneMode scene;
        private final String scenePath;
        private Platform platform = Platform.HOST;
        private boolean noDebug;
        private boolean profiling;
        private boolean debugCollisions;
        private boolean debugPaths;
        private boolean debugNavigation;
        private String additionalOptions;

        private Builder(String project, SceneMode scene, String scenePath) {
            this.project = project;
            this.scene = scene;
            this.scenePath = scenePath;
        }

        public Builder platform(Platform platform) {
            this.platform = platform;
            return this;
        }

        public Builder noDebug(boolean noDebug) {
            this.noDebug = noDebug;
            return this;
        }

        public Builder profiling(boolean profiling) {
            this.profiling = profiling;
            return this;
        }

        public Builder debugCollisions(boolean debugCollisions) {
            this.debugCollisions = debugCollisions;
            return this;
        }

        public Builder debugPaths(boolean debugPaths) {
            this.debugPaths = debugPaths;
            return this;
        }

        public Builder debugNavigation(boolean debugNavigation) {
            this.debugNavigation = debugNavigation;
            return this;
        }

        public Builder additionalOptions(String additionalOptions) {
            this.additionalOptions = additionalOptions;
            return this;
        }

        public GodotLaunchConfig build() {
            return new GodotLaunchConfig(this);
        }
    }
}
