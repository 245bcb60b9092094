package dev.dapbridge.server.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import dev.dapbridge.client.model.Variable;

/**
 * Readable renderings of the value strings Godot's debugger reports for its built-in types, such as
 * {@code Vector2(x=10, y=20)} for a Vector2 shown as {@code (10, 20)}.
 */
public final class GodotValueFormatter {

	private static final Pattern RECT2 = Pattern
		.compile("\\[P:\\s*\\(([^,]+),\\s*([^)]+)\\),\\s*S:\\s*\\(([^,]+),\\s*([^)]+)\\)\\]");

	private static final Pattern AABB = Pattern.compile(
			"\\[P:\\s*\\(([^,]+),\\s*([^,]+),\\s*([^)]+)\\),\\s*S:\\s*\\(([^,]+),\\s*([^,]+),\\s*([^)]+)\\)\\]");

	private static final Pattern TRANSFORM2D = Pattern
		.compile("\\[X:\\s*\\(([^)]+)\\),\\s*Y:\\s*\\(([^)]+)\\),\\s*O:\\s*\\(([^)]+)\\)\\]");

	private static final Pattern NODE_INSTANCE = Pattern.compile("<([^#]+)#(\\d+)>");

	private static final Set<String> NODE_TYPES = Set.of("Node", "Node2D", "Node3D", "Control", "CanvasItem",
			"Spatial", "Sprite2D", "Sprite3D", "CharacterBody2D", "CharacterBody3D", "RigidBody2D", "RigidBody3D",
			"StaticBody2D", "StaticBody3D", "Area2D", "Area3D", "Camera2D", "Camera3D", "Label", "Button", "Panel",
			"CollisionShape2D", "CollisionShape3D");

	private static final int DICTIONARY_INLINE_LIMIT = 50;

	private static final int ARRAY_PREVIEW = 3;

	private GodotValueFormatter() {
	}

	/**
	 * Render a variable for a tool result.
	 * @param variable variable reported by the debugger
	 * @return map with {@code name}, {@code value} and {@code type}, plus {@code formatted},
	 * {@code expandable}/{@code variables_reference} and {@code evaluate_name} when they apply
	 */
	public static Map<String, Object> formatVariable(Variable variable) {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("name", variable.name());
		result.put("value", variable.value());
		result.put("type", variable.type());
		String formatted = format(variable.type(), variable.value());
		if (formatted != null) {
			result.put("formatted", formatted);
		}
		if (variable.hasChildren()) {
			result.put("expandable", true);
			result.put("variables_reference", variable.variablesReference());
		}
		if (variable.evaluateName() != null && !variable.evaluateName().isEmpty()) {
			result.put("evaluate_name", variable.evaluateName());
		}
		return result;
	}

	public static List<Map<String, Object>> formatVariables(List<Variable> variables) {
		List<Map<String, Object>> result = new ArrayList<>(variables.size());
		for (Variable variable : variables) {
			result.add(formatVariable(variable));
		}
		return result;
	}

	/**
	 * Format a value of a Godot type.
	 * @param type type name reported by the debugger
	 * @param value value string reported by the debugger
	 * @return the readable form, or {@code null} when the type is not recognised or the value does
	 * not have the expected shape
	 */
	public static String format(String type, String value) {
		if (type == null || value == null) {
			return null;
		}
		switch (type) {
			case "Vector2":
			case "Vector2i":
				return components(value, 2, "Vector2(x=%s, y=%s)");
			case "Vector3":
			case "Vector3i":
				return components(value, 3, "Vector3(x=%s, y=%s, z=%s)");
			case "Vector4":
			case "Vector4i":
				return components(value, 4, "Vector4(x=%s, y=%s, z=%s, w=%s)");
			case "Color":
				return components(value, 4, "Color(r=%s, g=%s, b=%s, a=%s)");
			case "Plane":
				return components(value, 4, "Plane(normal=(%s, %s, %s), d=%s)");
			case "Quaternion":
				return components(value, 4, "Quat(x=%s, y=%s, z=%s, w=%s)");
			case "Rect2":
			case "Rect2i":
				return match(RECT2, value, "Rect2(pos=(%s, %s), size=(%s, %s))");
			case "AABB":
				return match(AABB, value, "AABB(pos=(%s, %s, %s), size=(%s, %s, %s))");
			case "Transform2D":
				return match(TRANSFORM2D, value, "Transform2D(x=%s, y=%s, origin=%s)");
			case "Transform3D":
				return value.contains("[X:") && value.contains("O:") ? "Transform3D(...)" : null;
			case "Basis":
				return value.contains("[X:") && value.contains("Y:") && value.contains("Z:") ? "Basis(...)" : null;
			case "Array":
				return formatArray(value);
			case "Dictionary":
				return formatDictionary(value);
			default:
				return isNodeType(type) ? formatNode(type, value) : null;
		}
	}

	/**
	 * Whether the type is a Node class or, judging by its name, likely inherits from Node.
	 */
	public static boolean isNodeType(String type) {
		return NODE_TYPES.contains(type) || type.contains("Node") || type.contains("Body") || type.contains("Area")
				|| type.contains("Control");
	}

	private static String components(String value, int expected, String template) {
		String trimmed = value.trim();
		if (!trimmed.startsWith("(") || !trimmed.endsWith(")") || trimmed.length() < 2) {
			return null;
		}
		String[] parts = trimmed.substring(1, trimmed.length() - 1).split(",", -1);
		if (parts.length != expected) {
			return null;
		}
		Object[] values = new Object[expected];
		for (int i = 0; i < expected; i++) {
			values[i] = parts[i].trim();
		}
		return String.format(template, values);
	}

	private static String match(Pattern pattern, String value, String template) {
		Matcher matcher = pattern.matcher(value);
		if (!matcher.find()) {
			return null;
		}
		Object[] groups = new Object[matcher.groupCount()];
		for (int i = 0; i < groups.length; i++) {
			groups[i] = matcher.group(i + 1).trim();
		}
		return String.format(template, groups);
	}

	private static String formatArray(String value) {
		if (!value.startsWith("[") || !value.endsWith("]") || value.length() < 2) {
			return null;
		}
		String content = value.substring(1, value.length() - 1).trim();
		if (content.isEmpty()) {
			return "Array(empty)";
		}
		String[] elements = content.split(",", -1);
		if (elements.length <= ARRAY_PREVIEW) {
			return "Array(" + elements.length + "): " + value;
		}
		List<String> preview = new ArrayList<>(ARRAY_PREVIEW);
		for (int i = 0; i < ARRAY_PREVIEW; i++) {
			preview.add(elements[i].trim());
		}
		return "Array(" + elements.length + "): [" + String.join(", ", preview) + ", ...]";
	}

	private static String formatDictionary(String value) {
		if (!value.startsWith("{") || !value.endsWith("}") || value.length() < 2) {
			return null;
		}
		String content = value.substring(1, value.length() - 1).trim();
		if (content.isEmpty()) {
			return "Dictionary(empty)";
		}
		// colons approximate the key count
		long keys = content.chars().filter(c -> c == ':').count();
		if (keys == 0) {
			return "Dictionary(...)";
		}
		if (content.length() <= DICTIONARY_INLINE_LIMIT) {
			return "Dictionary(" + keys + "): " + value;
		}
		return "Dictionary(" + keys + " keys)";
	}

	private static String formatNode(String type, String value) {
		if ("<null>".equals(value) || "null".equals(value)) {
			return type + "(null)";
		}
		Matcher matcher = NODE_INSTANCE.matcher(value);
		if (matcher.find()) {
			return matcher.group(1) + " (ID:" + matcher.group(2) + ")";
		}
		return type + ": " + value;
	}

}
