package works.lattice.codec.io;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.time.temporal.Temporal;
import java.util.Base64;
import java.util.function.Consumer;
import works.lattice.codec.ContainerType;
import works.lattice.codec.DateTimeText;
import works.lattice.codec.JsonToken;
import works.lattice.codec.JsonWriter;
import works.lattice.codec.WriterSettings;
import works.lattice.codec.WriterSettings.DateFormatHandling;

import static java.util.Objects.requireNonNull;

/**
 * A {@link JsonWriter} that produces JSON text.
 * <p>
 * Output is not buffered here; wrap the destination in a
 * {@link java.io.BufferedWriter} if it needs buffering.
 */
public final class JsonTextWriter extends JsonWriter {
	private final Writer out;

	public JsonTextWriter(Writer destination) {
		this(destination, WriterSettings.DEFAULT);
	}

	public JsonTextWriter(Writer destination, WriterSettings settings) {
		super(settings);
		if (settings.quoteChar() != '"' && settings.quoteChar() != '\'') {
			throw new IllegalArgumentException("Invalid quote character: " + settings.quoteChar());
		}
		this.out = requireNonNull(destination);
	}

	/**
	 * Convenience for tests and small documents: runs {@code action} against a writer
	 * on a {@link StringWriter} and returns the text.
	 */
	public static String writeToString(WriterSettings settings, Consumer<? super JsonTextWriter> action) {
		StringWriter sw = new StringWriter();
		try (JsonTextWriter writer = new JsonTextWriter(sw, settings)) {
			action.accept(writer);
		}
		return sw.toString();
	}

	@Override
	public void flush() {
		try {
			out.flush();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	@Override
	protected void closeOutput() {
		try {
			out.flush();
			if (settings.closeOutput()) {
				out.close();
			}
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	@Override
	protected void emitStart(ContainerType type, String constructorName) {
		switch (type) {
			case OBJECT -> print('{');
			case ARRAY -> print('[');
			case CONSTRUCTOR -> {
				print("new ");
				print(constructorName);
				print('(');
			}
			case NONE -> throw new IllegalArgumentException("Can't start " + type);
		}
	}

	@Override
	protected void emitEnd(ContainerType type) {
		switch (type) {
			case OBJECT -> print('}');
			case ARRAY -> print(']');
			case CONSTRUCTOR -> print(')');
			case NONE -> throw new IllegalArgumentException("Can't end " + type);
		}
	}

	@Override
	protected void emitPropertyName(String name) {
		if (settings.quoteName()) {
			writeString(name);
		} else {
			print(name);
		}
		print(':');
	}

	@Override
	protected void emitValue(JsonToken token, Object value) {
		switch (token) {
			case NULL -> print("null");
			case UNDEFINED -> print("undefined");
			case BOOLEAN -> print(((Boolean) value) ? "true" : "false");
			case INTEGER -> print(value.toString());
			case FLOAT -> print(value instanceof BigDecimal b ? formatDecimal(b) : formatDouble((Double) value));
			case STRING -> writeString(value.toString());
			case DATE -> writeDate((Temporal) value);
			case BYTES -> writeString(Base64.getEncoder().encodeToString((byte[]) value));
			default -> throw new IllegalArgumentException("Not a value token: " + token);
		}
	}

	@Override
	protected void emitComment(String text) {
		print("/*");
		print(text);
		print("*/");
	}

	@Override
	protected void emitRaw(String json, boolean asValue) {
		print(json);
	}

	@Override
	protected void writeIndent() {
		print('\n');
		int count = top() * settings.indentation();
		for (int i = 0; i < count; i++) {
			print(settings.indentChar());
		}
	}

	@Override
	protected void writeValueDelimiter() {
		print(',');
	}

	@Override
	protected void writeIndentSpace() {
		print(' ');
	}

	@Override
	protected void writeTopLevelSeparator() {
		print('\n');
	}

	private void print(char c) {
		try {
			out.write(c);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	private void print(CharSequence text) {
		try {
			out.append(text);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	private void writeString(String s) {
		StringBuilder sb = new StringBuilder(s.length() + 2);
		StringEscapes.appendLiteral(sb, s, settings.quoteChar(), settings.stringEscapeHandling());
		print(sb);
	}

	private void writeDate(Temporal date) {
		if (settings.dateFormatHandling() == DateFormatHandling.MICROSOFT) {
			// The escaped slashes distinguish a date from an ordinary string
			String text = DateTimeText.formatMicrosoft(date);
			char q = settings.quoteChar();
			print(q);
			print(text.replace("/", "\\/"));
			print(q);
		} else {
			writeString(DateTimeText.formatIso(date));
		}
	}

	private String formatDouble(double d) {
		if (Double.isFinite(d)) {
			return Double.toString(d);
		}
		return switch (settings.floatFormatHandling()) {
			case SYMBOL -> Double.isNaN(d) ? "NaN" : (d > 0 ? "Infinity" : "-Infinity");
			case STRING -> {
				String symbol = Double.isNaN(d) ? "NaN" : (d > 0 ? "Infinity" : "-Infinity");
				char q = settings.quoteChar();
				yield q + symbol + q;
			}
			case DEFAULT_VALUE -> "0.0";
		};
	}

	private static String formatDecimal(BigDecimal b) {
		String text = b.toString();
		if (text.indexOf('.') < 0 && text.indexOf('E') < 0) {
			return text + ".0";
		}
		return text;
	}
}
