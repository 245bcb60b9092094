package dev.dapbridge.server.tool;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import dev.dapbridge.client.model.Variable;

class GodotValueFormatterTest {

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
			"Vector2|(10, 20)|Vector2(x=10, y=20)",
			"Vector2i|(3, -4)|Vector2(x=3, y=-4)",
			"Vector3|(1.5, 2, 3)|Vector3(x=1.5, y=2, z=3)",
			"Vector4|(1, 2, 3, 4)|Vector4(x=1, y=2, z=3, w=4)",
			"Color|(1, 0.5, 0, 1)|Color(r=1, g=0.5, b=0, a=1)",
			"Plane|(0, 1, 0, 5)|Plane(normal=(0, 1, 0), d=5)",
			"Quaternion|(0, 0, 0, 1)|Quat(x=0, y=0, z=0, w=1)",
			"Rect2|[P: (0, 10), S: (100, 50)]|Rect2(pos=(0, 10), size=(100, 50))",
			"AABB|[P: (0, 0, 0), S: (1, 2, 3)]|AABB(pos=(0, 0, 0), size=(1, 2, 3))",
			"Transform2D|[X: (1, 0), Y: (0, 1), O: (5, 6)]|Transform2D(x=1, 0, y=0, 1, origin=5, 6)",
			"Transform3D|[X: (1, 0, 0), Y: (0, 1, 0), Z: (0, 0, 1), O: (0, 0, 0)]|Transform3D(...)",
			"Transform3D|[X: (0, 0, -1), Y: (0, 1, 0), Z: (1, 0, 0), O: (2.5, 0, -4)]|Transform3D(...)",
			"Basis|[X: (1, 0, 0), Y: (0, 1, 0), Z: (0, 0, 1)]|Basis(...)",
			"Array|[]|Array(empty)",
			"Array|[1, 2]|Array(2): [1, 2]",
			"Array|[1, 2, 3, 4, 5]|Array(5): [1, 2, 3, ...]",
			"Dictionary|{}|Dictionary(empty)",
			"Dictionary|{\"hp\": 10}|Dictionary(1): {\"hp\": 10}",
			"Dictionary|{1, 2}|Dictionary(...)",
			"Node2D|<null>|Node2D(null)",
			"Node2D|<CharacterBody2D#123>|CharacterBody2D (ID:123)",
			"Button|Play|Button: Play" })
	void formatsGodotValues(String type, String value, String expected) {
		assertThat(GodotValueFormatter.format(type, value)).isEqualTo(expected);
	}

	@Test
	void longDictionariesOnlyReportTheKeyCount() {
		String value = "{\"name\": \"player one\", \"health\": 100, \"position\": (10, 20), \"alive\": true}";

		assertThat(GodotValueFormatter.format("Dictionary", value)).isEqualTo("Dictionary(4 keys)");
	}

	@Test
	void unknownTypesAndMalformedValuesAreNotFormatted() {
		assertThat(GodotValueFormatter.format("int", "42")).isNull();
		assertThat(GodotValueFormatter.format("String", "hello")).isNull();
		assertThat(GodotValueFormatter.format("Vector2", "(1, 2, 3)")).isNull();
		assertThat(GodotValueFormatter.format("Vector3", "1, 2, 3")).isNull();
		assertThat(GodotValueFormatter.format("Rect2", "garbage")).isNull();
		assertThat(GodotValueFormatter.format("Transform3D", "[X: (1, 0, 0), Y: (0, 1, 0), Z: (0, 0, 1)]")).isNull();
		assertThat(GodotValueFormatter.format(null, "x")).isNull();
	}

	@Test
	void nodeTypesAreRecognisedByNameOrList() {
		assertThat(GodotValueFormatter.isNodeType("Label")).isTrue();
		assertThat(GodotValueFormatter.isNodeType("MeshInstance3DNode")).isTrue();
		assertThat(GodotValueFormatter.isNodeType("PhysicsBody3D")).isTrue();
		assertThat(GodotValueFormatter.isNodeType("Resource")).isFalse();
	}

	@Test
	void formatVariableAddsExpansionDetails() {
		Variable variable = new Variable("position", "(1, 2)", "Vector2", 7, "self.position");

		Map<String, Object> formatted = GodotValueFormatter.formatVariable(variable);

		assertThat(formatted).containsEntry("name", "position")
			.containsEntry("value", "(1, 2)")
			.containsEntry("type", "Vector2")
			.containsEntry("formatted", "Vector2(x=1, y=2)")
			.containsEntry("expandable", true)
			.containsEntry("variables_reference", 7)
			.containsEntry("evaluate_name", "self.position");
	}

	@Test
	void formatVariableOmitsAbsentDetails() {
		Variable variable = new Variable("score", "10", "int", 0, null);

		assertThat(GodotValueFormatter.formatVariable(variable)).containsOnlyKeys("name", "value", "type");
	}

}
