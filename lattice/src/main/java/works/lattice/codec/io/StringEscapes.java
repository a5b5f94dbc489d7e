package works.lattice.codec.io;

import works.lattice.codec.WriterSettings.StringEscapeHandling;

/**
 * Rendering of JSON string literals.
 */
public final class StringEscapes {
	private StringEscapes() { }

	/**
	 * Appends {@code s}, escaped and surrounded by {@code quoteChar}.
	 * Only the given quote character is escaped, so single-quoted strings
	 * can contain unescaped double quotes and vice versa.
	 */
	public static void appendLiteral(StringBuilder sb, String s, char quoteChar, StringEscapeHandling handling) {
		sb.append(quoteChar);
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '\\': sb.append("\\\\"); break;
				case '\b': sb.append("\\b"); break;
				case '\f': sb.append("\\f"); break;
				case '\n': sb.append("\\n"); break;
				case '\r': sb.append("\\r"); break;
				case '\t': sb.append("\\t"); break;
				default:
					if (c == quoteChar) {
						sb.append('\\').append(c);
					} else if (needsUnicodeEscape(c, handling)) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
			}
		}
		sb.append(quoteChar);
	}

	private static boolean needsUnicodeEscape(char c, StringEscapeHandling handling) {
		if (c < 0x20 || c == '\u0085' || c == '\u2028' || c == '\u2029') {
			return true;
		}
		return switch (handling) {
			case DEFAULT -> false;
			case ESCAPE_NON_ASCII -> c > 0x7E;
			case ESCAPE_HTML -> c > 0x7E || c == '<' || c == '>' || c == '&' || c == '\'' || c == '"';
		};
	}
}
