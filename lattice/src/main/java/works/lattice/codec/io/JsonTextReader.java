package works.lattice.codec.io;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.Temporal;
import java.util.Arrays;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lattice.codec.DateTimeText;
import works.lattice.codec.JsonReader;
import works.lattice.codec.JsonToken;
import works.lattice.codec.ReaderSettings;
import works.lattice.codec.ReaderSettings.FloatParseHandling;
import works.lattice.codec.ReaderState;

/**
 * A {@link JsonReader} that parses JSON text.
 * <p>
 * Beyond standard JSON, this accepts single-quoted strings,
 * {@code //} and {@code /*} comments, unquoted property names,
 * {@code undefined}, {@code NaN}, {@code Infinity}, {@code -Infinity},
 * and {@code new Name(...)} constructors.
 */
public final class JsonTextReader extends JsonReader {
	private static final Logger LOGGER = LoggerFactory.getLogger(JsonTextReader.class);

	private static final int INITIAL_BUFFER_SIZE = 1024;
	private static final int EOF = -1;

	private final Reader input;
	private char[] chars = new char[INITIAL_BUFFER_SIZE];
	private int pos = 0;
	private int end = 0;
	private boolean inputExhausted = false;

	private int lineNumber = 1;
	private int linePosition = 0;
	private boolean afterCarriageReturn = false;

	public JsonTextReader(Reader input) {
		this(input, ReaderSettings.DEFAULT);
	}

	public JsonTextReader(Reader input, ReaderSettings settings) {
		super(settings);
		this.input = input;
	}

	public static JsonTextReader forString(String json) {
		return new JsonTextReader(new StringReader(json));
	}

	public static JsonTextReader forString(String json, ReaderSettings settings) {
		return new JsonTextReader(new StringReader(json), settings);
	}

	@Override
	public boolean hasLineInfo() {
		return true;
	}

	@Override
	public int lineNumber() {
		return lineNumber;
	}

	@Override
	public int linePosition() {
		return linePosition;
	}

	@Override
	protected void closeInput() {
		if (settings.closeInput()) {
			try {
				input.close();
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		}
	}

	@Override
	public boolean read() {
		while (true) {
			switch (currentState()) {
				case START, PROPERTY, ARRAY_START, ARRAY, CONSTRUCTOR_START, CONSTRUCTOR -> {
					return parseValue();
				}
				case OBJECT_START, OBJECT -> {
					return parseObject();
				}
				case POST_VALUE -> {
					Boolean result = parsePostValue();
					if (result != null) {
						return result;
					}
					// Consumed a delimiter; go around again
				}
				case FINISHED -> {
					return parseFinished();
				}
				case CLOSED -> {
					return false;
				}
				case ERROR -> throw readerFailure("Reader is in the error state");
			}
		}
	}

	//
	// Grammar
	//

	private boolean parseValue() {
		ReaderState state = currentState();
		skipWhitespace();
		int c = peekChar();
		switch (c) {
			case EOF -> {
				if (state == ReaderState.START && depth() == 0) {
					setToken(JsonToken.NONE, null);
					return false;
				}
				throw readerFailure("Unexpected end when parsing value");
			}
			case '"', '\'' -> {
				String s = parseString();
				Optional<Temporal> date = DateTimeText.tryParse(s, settings.dateParseHandling());
				if (date.isPresent()) {
					setToken(JsonToken.DATE, date.get());
				} else {
					setToken(JsonToken.STRING, s);
				}
				return true;
			}
			case '{' -> {
				nextChar();
				setToken(JsonToken.START_OBJECT, null);
				return true;
			}
			case '[' -> {
				nextChar();
				setToken(JsonToken.START_ARRAY, null);
				return true;
			}
			case ']' -> {
				if (state == ReaderState.ARRAY_START) {
					nextChar();
					setToken(JsonToken.END_ARRAY, null);
					return true;
				}
				throw readerFailure("Unexpected character encountered while parsing value: ]");
			}
			case ')' -> {
				if (state == ReaderState.CONSTRUCTOR_START) {
					nextChar();
					setToken(JsonToken.END_CONSTRUCTOR, null);
					return true;
				}
				throw readerFailure("Unexpected character encountered while parsing value: )");
			}
			case '/' -> {
				setToken(JsonToken.COMMENT, parseComment());
				return true;
			}
			case 't' -> {
				parseLiteral("true");
				setToken(JsonToken.BOOLEAN, Boolean.TRUE);
				return true;
			}
			case 'f' -> {
				parseLiteral("false");
				setToken(JsonToken.BOOLEAN, Boolean.FALSE);
				return true;
			}
			case 'n' -> {
				if (peekCharAt(1) == 'e') {
					parseConstructor();
				} else {
					parseLiteral("null");
					setToken(JsonToken.NULL, null);
				}
				return true;
			}
			case 'u' -> {
				parseLiteral("undefined");
				setToken(JsonToken.UNDEFINED, null);
				return true;
			}
			case 'N' -> {
				parseLiteral("NaN");
				setToken(JsonToken.FLOAT, nonFinite(Double.NaN));
				return true;
			}
			case 'I' -> {
				parseLiteral("Infinity");
				setToken(JsonToken.FLOAT, nonFinite(Double.POSITIVE_INFINITY));
				return true;
			}
			default -> {
				if (c == '-' && peekCharAt(1) == 'I') {
					parseLiteral("-Infinity");
					setToken(JsonToken.FLOAT, nonFinite(Double.NEGATIVE_INFINITY));
					return true;
				} else if (c == '-' || (c >= '0' && c <= '9')) {
					parseNumber();
					return true;
				}
				throw readerFailure("Unexpected character encountered while parsing value: " + describe(c));
			}
		}
	}

	private boolean parseObject() {
		ReaderState state = currentState();
		skipWhitespace();
		int c = peekChar();
		String name;
		if (c == '}' && state == ReaderState.OBJECT_START) {
			nextChar();
			setToken(JsonToken.END_OBJECT, null);
			return true;
		} else if (c == '/') {
			setToken(JsonToken.COMMENT, parseComment());
			return true;
		} else if (c == '"' || c == '\'') {
			name = parseString();
		} else if (isIdentifierChar(c)) {
			name = parseIdentifier();
		} else if (c == EOF) {
			throw readerFailure("Unexpected end while parsing property name");
		} else {
			throw readerFailure("Invalid property identifier character: " + describe(c));
		}
		skipWhitespace();
		c = peekChar();
		if (c != ':') {
			throw readerFailure("Invalid character after parsing property name. Expected ':' but got: " + describe(c));
		}
		nextChar();
		setToken(JsonToken.PROPERTY_NAME, name);
		return true;
	}

	/**
	 * @return the result of {@link #read()}, or null if a delimiter was consumed and parsing should continue
	 */
	private Boolean parsePostValue() {
		skipWhitespace();
		int c = peekChar();
		switch (c) {
			case '}' -> {
				nextChar();
				setToken(JsonToken.END_OBJECT, null);
				return true;
			}
			case ']' -> {
				nextChar();
				setToken(JsonToken.END_ARRAY, null);
				return true;
			}
			case ')' -> {
				nextChar();
				setToken(JsonToken.END_CONSTRUCTOR, null);
				return true;
			}
			case '/' -> {
				setToken(JsonToken.COMMENT, parseComment());
				return true;
			}
			case ',' -> {
				if (depth() == 0) {
					throw readerFailure("Unexpected character encountered after top-level value: ,");
				}
				nextChar();
				setState(stateInsideContainer());
				return null;
			}
			case EOF -> {
				if (depth() > 0) {
					throw readerFailure("Unexpected end of input inside " + peek());
				}
				setToken(JsonToken.NONE, null);
				return false;
			}
			default -> {
				if (depth() == 0 && settings.supportMultipleContent()) {
					setState(ReaderState.START);
					return null;
				}
				throw readerFailure("After parsing a value an unexpected character was encountered: " + describe(c));
			}
		}
	}

	private boolean parseFinished() {
		skipWhitespace();
		int c = peekChar();
		if (c == EOF) {
			setToken(JsonToken.NONE, null);
			return false;
		} else if (c == '/') {
			setToken(JsonToken.COMMENT, parseComment());
			return true;
		}
		throw readerFailure("Additional text encountered after finished reading JSON content: " + describe(c));
	}

	private void parseConstructor() {
		parseKeyword("new");
		int c = peekChar();
		if (!isWhitespace(c)) {
			throw readerFailure("Unexpected character while parsing constructor: " + describe(c));
		}
		skipWhitespace();
		if (!isIdentifierChar(peekChar())) {
			throw readerFailure("Unexpected character while parsing constructor name: " + describe(peekChar()));
		}
		String name = parseIdentifier();
		skipWhitespace();
		c = peekChar();
		if (c != '(') {
			throw readerFailure("Unexpected character while parsing constructor: " + describe(c));
		}
		nextChar();
		if (settings.readDateConstructorAsDate() && "Date".equals(name)) {
			Long millis = tryConsumeDateArgument();
			if (millis != null) {
				setToken(JsonToken.DATE, Instant.ofEpochMilli(millis).atOffset(ZoneOffset.UTC));
				return;
			}
		}
		setToken(JsonToken.START_CONSTRUCTOR, name);
	}

	/**
	 * Looks ahead for {@code <integer>)}; if found, consumes it.
	 *
	 * @return the integer, or null if the constructor has some other argument list
	 */
	private Long tryConsumeDateArgument() {
		int offset = 0;
		while (isWhitespace(peekCharAt(offset))) {
			offset++;
		}
		int digitsStart = offset;
		if (peekCharAt(offset) == '-') {
			offset++;
		}
		int firstDigit = offset;
		while (peekCharAt(offset) >= '0' && peekCharAt(offset) <= '9') {
			offset++;
		}
		if (offset == firstDigit) {
			return null;
		}
		int digitsEnd = offset;
		while (isWhitespace(peekCharAt(offset))) {
			offset++;
		}
		if (peekCharAt(offset) != ')') {
			return null;
		}
		long millis;
		try {
			millis = Long.parseLong(new String(chars, pos + digitsStart, digitsEnd - digitsStart));
		} catch (NumberFormatException e) {
			return null;
		}
		for (int i = 0; i <= offset; i++) {
			nextChar();
		}
		return millis;
	}

	//
	// Lexical elements
	//

	private String parseString() {
		int quote = nextChar();
		StringBuilder sb = new StringBuilder();
		while (true) {
			int c = nextChar();
			if (c == EOF) {
				throw readerFailure("Unterminated string. Expected delimiter: " + (char) quote);
			} else if (c == quote) {
				return sb.toString();
			} else if (c == '\\') {
				int esc = nextChar();
				switch (esc) {
					case '"', '\'', '\\', '/' -> sb.append((char) esc);
					case 'b' -> sb.append('\b');
					case 'f' -> sb.append('\f');
					case 'n' -> sb.append('\n');
					case 'r' -> sb.append('\r');
					case 't' -> sb.append('\t');
					case 'u' -> sb.append(parseUnicodeEscape());
					case EOF -> throw readerFailure("Unterminated string. Expected delimiter: " + (char) quote);
					default -> throw readerFailure("Bad JSON escape sequence: \\" + (char) esc);
				}
			} else if (c < 0x20) {
				throw readerFailure("Invalid character in string: " + describe(c));
			} else {
				sb.append((char) c);
			}
		}
	}

	private char parseUnicodeEscape() {
		int value = 0;
		for (int i = 0; i < 4; i++) {
			int c = nextChar();
			int digit = (c == EOF) ? -1 : Character.digit(c, 16);
			if (digit < 0) {
				throw readerFailure("Invalid Unicode escape sequence: expected hex digit, got " + describe(c));
			}
			value = (value << 4) | digit;
		}
		return (char) value;
	}

	private String parseIdentifier() {
		StringBuilder sb = new StringBuilder();
		while (isIdentifierChar(peekChar())) {
			sb.append((char) nextChar());
		}
		return sb.toString();
	}

	private String parseComment() {
		nextChar(); // The slash
		int c = nextChar();
		StringBuilder sb = new StringBuilder();
		if (c == '*') {
			while (true) {
				c = nextChar();
				if (c == EOF) {
					throw readerFailure("Unexpected end while parsing comment");
				} else if (c == '*' && peekChar() == '/') {
					nextChar();
					return sb.toString();
				}
				sb.append((char) c);
			}
		} else if (c == '/') {
			while (peekChar() != EOF && peekChar() != '\n' && peekChar() != '\r') {
				sb.append((char) nextChar());
			}
			return sb.toString();
		}
		throw readerFailure("Error parsing comment. Expected: *, got " + describe(c));
	}

	private void parseNumber() {
		StringBuilder sb = new StringBuilder();
		while (isNumberChar(peekChar())) {
			sb.append((char) nextChar());
		}
		String text = sb.toString();
		if (!isValidNumber(text)) {
			throw readerFailure("Invalid number: " + text);
		}
		requireDelimiter("number");
		boolean isInteger = text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0;
		if (isInteger) {
			if (text.length() < 19) {
				setToken(JsonToken.INTEGER, Long.parseLong(text));
			} else {
				BigInteger big = new BigInteger(text);
				if (big.bitLength() < 64) {
					setToken(JsonToken.INTEGER, big.longValue());
				} else {
					setToken(JsonToken.INTEGER, big);
				}
			}
		} else if (settings.floatParseHandling() == FloatParseHandling.DECIMAL) {
			setToken(JsonToken.FLOAT, new BigDecimal(text));
		} else {
			setToken(JsonToken.FLOAT, Double.parseDouble(text));
		}
	}

	/**
	 * Strict JSON number grammar: {@code -?(0|[1-9][0-9]*)(\.[0-9]+)?([eE][+-]?[0-9]+)?}
	 */
	static boolean isValidNumber(String text) {
		int i = 0;
		int n = text.length();
		if (i < n && text.charAt(i) == '-') {
			i++;
		}
		if (i >= n) {
			return false;
		}
		if (text.charAt(i) == '0') {
			i++;
		} else if (isDigit(text.charAt(i))) {
			while (i < n && isDigit(text.charAt(i))) {
				i++;
			}
		} else {
			return false;
		}
		if (i < n && text.charAt(i) == '.') {
			i++;
			int start = i;
			while (i < n && isDigit(text.charAt(i))) {
				i++;
			}
			if (i == start) {
				return false;
			}
		}
		if (i < n && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
			i++;
			if (i < n && (text.charAt(i) == '+' || text.charAt(i) == '-')) {
				i++;
			}
			int start = i;
			while (i < n && isDigit(text.charAt(i))) {
				i++;
			}
			if (i == start) {
				return false;
			}
		}
		return i == n;
	}

	private Object nonFinite(double value) {
		if (settings.floatParseHandling() == FloatParseHandling.DECIMAL) {
			throw readerFailure("Cannot read " + value + " as a decimal");
		}
		return value;
	}

	private void parseLiteral(String literal) {
		parseKeyword(literal);
		requireDelimiter("value");
	}

	private void parseKeyword(String keyword) {
		for (int i = 0; i < keyword.length(); i++) {
			int c = peekChar();
			if (c != keyword.charAt(i)) {
				if (c == EOF) {
					throw readerFailure("Unexpected end while parsing " + keyword);
				}
				throw readerFailure("Unexpected character while parsing " + keyword + ": " + describe(c));
			}
			nextChar();
		}
	}

	private void requireDelimiter(String what) {
		int c = peekChar();
		if (c == EOF || isWhitespace(c) || c == ',' || c == ']' || c == '}' || c == ')' || c == '/') {
			return;
		}
		throw readerFailure("Unexpected character encountered while parsing " + what + ": " + describe(c));
	}

	private void skipWhitespace() {
		while (isWhitespace(peekChar())) {
			nextChar();
		}
	}

	private static boolean isWhitespace(int c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r' || (c > ' ' && Character.isWhitespace(c));
	}

	private static boolean isIdentifierChar(int c) {
		return c != EOF && (Character.isLetterOrDigit(c) || c == '_' || c == '$');
	}

	private static boolean isNumberChar(int c) {
		return isDigit(c) || c == '.' || c == '-' || c == '+' || c == 'e' || c == 'E';
	}

	private static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	private static String describe(int c) {
		return c == EOF ? "end of input" : "'" + (char) c + "'";
	}

	//
	// Character buffer
	//

	private int peekChar() {
		return peekCharAt(0);
	}

	/**
	 * @return the character {@code offset} positions ahead, without consuming anything
	 */
	private int peekCharAt(int offset) {
		if (pos + offset >= end && !fill(offset + 1)) {
			return EOF;
		}
		return chars[pos + offset];
	}

	/**
	 * Consumes one character and updates the line information.
	 */
	private int nextChar() {
		int c = peekChar();
		if (c == EOF) {
			return EOF;
		}
		pos++;
		if (c == '\n') {
			if (!afterCarriageReturn) {
				lineNumber++;
			}
			linePosition = 0;
			afterCarriageReturn = false;
		} else if (c == '\r') {
			lineNumber++;
			linePosition = 0;
			afterCarriageReturn = true;
		} else {
			linePosition++;
			afterCarriageReturn = false;
		}
		return c;
	}

	/**
	 * Ensures at least {@code needed} characters are available from {@code pos}.
	 *
	 * @return false if the input ran out first
	 */
	private boolean fill(int needed) {
		if (pos > 0) {
			System.arraycopy(chars, pos, chars, 0, end - pos);
			end -= pos;
			pos = 0;
		}
		if (needed > chars.length) {
			chars = Arrays.copyOf(chars, Math.max(needed, chars.length * 2));
		}
		while (end < needed) {
			if (inputExhausted) {
				return false;
			}
			int count;
			try {
				count = input.read(chars, end, chars.length - end);
			} catch (IOException e) {
				throw readerFailure("Error reading input", e);
			}
			if (count < 0) {
				LOGGER.trace("Input exhausted at line {}, position {}", lineNumber, linePosition);
				inputExhausted = true;
				return false;
			}
			end += count;
		}
		return true;
	}
}
