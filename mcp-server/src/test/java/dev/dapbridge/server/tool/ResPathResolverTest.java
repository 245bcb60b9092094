package dev.dapbridge.server.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResPathResolverTest {

	@TempDir
	Path project;

	@Test
	void resPathsResolveAgainstTheProjectRoot() throws ToolException {
		String resolved = ResPathResolver.resolve("res://scripts/player.gd", project.toString());

		assertThat(resolved).isEqualTo(project.resolve("scripts").resolve("player.gd").toString());
	}

	@Test
	void absolutePathsAreKept() throws ToolException {
		String absolute = project.resolve("player.gd").toString();

		assertThat(ResPathResolver.resolve(absolute, null)).isEqualTo(absolute);
	}

	@Test
	void resPathsNeedAProjectRoot() {
		assertThatThrownBy(() -> ResPathResolver.resolve("res://player.gd", null))
			.isInstanceOf(ToolException.class)
			.hasMessageContaining("project root not set")
			.hasMessageContaining("godot_connect");
	}

	@Test
	void relativeAndEmptyPathsAreRejected() {
		assertThatThrownBy(() -> ResPathResolver.resolve("scripts/player.gd", project.toString()))
			.isInstanceOf(ToolException.class)
			.hasMessageStartingWith("Path must be absolute or start with res://");
		assertThatThrownBy(() -> ResPathResolver.resolve("", project.toString()))
			.hasMessageStartingWith("path cannot be empty");
	}

}
