package works.lattice.codec;

import java.util.List;

/**
 * One level of the position stack kept by readers and writers:
 * a container, plus either the name of the current property (for objects)
 * or the index of the current element (for arrays and constructors).
 * <p>
 * Readers and writers mutate these as they advance; the tree model
 * creates throwaway ones to compute node paths.
 */
public final class JsonPosition {
	private static final String SPECIAL_CHARACTERS = ". '/\"[]()\t\n\r\f\b\\\u0085\u2028\u2029";

	final ContainerType type;
	int position = -1;
	String propertyName;

	JsonPosition(ContainerType type) {
		this.type = type;
	}

	public static JsonPosition forProperty(String name) {
		JsonPosition result = new JsonPosition(ContainerType.OBJECT);
		result.propertyName = name;
		return result;
	}

	public static JsonPosition forIndex(ContainerType type, int index) {
		if (!type.hasIndex()) {
			throw new IllegalArgumentException(type + " containers have no index");
		}
		JsonPosition result = new JsonPosition(type);
		result.position = index;
		return result;
	}

	public ContainerType type() {
		return type;
	}

	/**
	 * @return the index of the current element, or -1 if no element has been reached yet
	 */
	public int position() {
		return position;
	}

	public String propertyName() {
		return propertyName;
	}

	/**
	 * @return true if there's something to report for this level:
	 * a property name for objects, or an element index for arrays and constructors.
	 */
	boolean hasSegment() {
		return type.hasIndex() ? position >= 0 : propertyName != null;
	}

	void appendTo(StringBuilder sb) {
		switch (type) {
			case OBJECT -> {
				if (containsSpecialCharacter(propertyName)) {
					sb.append("['");
					appendSingleQuoteEscaped(sb, propertyName);
					sb.append("']");
				} else {
					if (sb.length() > 0) {
						sb.append('.');
					}
					sb.append(propertyName);
				}
			}
			case ARRAY, CONSTRUCTOR -> sb.append('[').append(position).append(']');
			case NONE -> { }
		}
	}

	private static boolean containsSpecialCharacter(String name) {
		for (int i = 0; i < name.length(); i++) {
			if (SPECIAL_CHARACTERS.indexOf(name.charAt(i)) >= 0) {
				return true;
			}
		}
		return false;
	}

	private static void appendSingleQuoteEscaped(StringBuilder sb, String name) {
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			switch (c) {
				case '\'' -> sb.append("\\'");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				case '\f' -> sb.append("\\f");
				case '\b' -> sb.append("\\b");
				case '\u0085', '\u2028', '\u2029' -> sb.append(String.format("\\u%04x", (int) c));
				default -> sb.append(c);
			}
		}
	}

	/**
	 * Renders positions as a path like {@code a.b[2]} or {@code ['key.with.dot'][0]}.
	 * Positions with nothing to report (an array before its first element) are skipped.
	 */
	public static String buildPath(List<JsonPosition> positions) {
		StringBuilder sb = new StringBuilder();
		for (JsonPosition p : positions) {
			if (p.hasSegment()) {
				p.appendTo(sb);
			}
		}
		return sb.toString();
	}

	/**
	 * The message format shared by all our exceptions:
	 * {@code <message>. Path '<path>', line L, position P.}
	 */
	public static String formatMessage(LineInfo lineInfo, String path, String message) {
		StringBuilder sb = new StringBuilder(message.trim());
		if (sb.length() == 0 || sb.charAt(sb.length() - 1) != '.') {
			sb.append('.');
		}
		sb.append(" Path '").append(path).append('\'');
		if (lineInfo != null && lineInfo.hasLineInfo()) {
			sb.append(", line ").append(lineInfo.lineNumber())
				.append(", position ").append(lineInfo.linePosition());
		}
		sb.append('.');
		return sb.toString();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		appendTo(sb);
		return type + ":" + sb;
	}
}
