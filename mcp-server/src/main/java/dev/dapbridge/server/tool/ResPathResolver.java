package dev.dapbridge.server.tool;

import java.nio.file.Paths;

/**
 * Turns the file arguments of breakpoint tools into absolute paths the Godot debugger accepts.
 * {@code res://} paths are resolved against the project root, absolute paths are kept and relative
 * paths are rejected.
 */
public final class ResPathResolver {

	public static final String RES_PREFIX = "res://";

	private ResPathResolver() {
	}

	/**
	 * Resolve a script path.
	 * @param path {@code res://} or absolute path
	 * @param projectRoot project directory, or {@code null} when unknown
	 * @return absolute path as a string
	 * @throws ToolException when the path is empty, relative, or a {@code res://} path without project root
	 */
	public static String resolve(String path, String projectRoot) throws ToolException {
		if (path == null || path.isEmpty()) {
			throw ToolErrors.invalidArgument("path cannot be empty");
		}
		if (path.startsWith(RES_PREFIX)) {
			if (projectRoot == null || projectRoot.isEmpty()) {
				throw ToolErrors.invalidArgument(
						"Cannot resolve res:// path '" + path + "': project root not set",
						"Provide the 'project' argument to godot_connect()", "Use an absolute path instead");
			}
			return Paths.get(projectRoot).resolve(path.substring(RES_PREFIX.length())).normalize().toString();
		}
		if (Paths.get(path).isAbsolute()) {
			return path;
		}
		throw ToolErrors.invalidArgument("Path must be absolute or start with res:// (got: " + path + ")");
	}

}
