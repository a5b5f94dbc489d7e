package works.lattice.codec;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonPositionTest {

	@Test
	void plainPath() {
		assertEquals("a.b[2]", JsonPosition.buildPath(List.of(
			JsonPosition.forProperty("a"),
			JsonPosition.forProperty("b"),
			JsonPosition.forIndex(ContainerType.ARRAY, 2))));
	}

	@Test
	void specialNamesAreBracketed() {
		assertEquals("['it\\'s'][0]['x y']", JsonPosition.buildPath(List.of(
			JsonPosition.forProperty("it's"),
			JsonPosition.forIndex(ContainerType.CONSTRUCTOR, 0),
			JsonPosition.forProperty("x y"))));
	}

	@ParameterizedTest
	@EnumSource(value = ContainerType.class, names = {"OBJECT", "NONE"})
	void indexNeedsAnIndexedContainer(ContainerType type) {
		assertThrows(IllegalArgumentException.class, () -> JsonPosition.forIndex(type, 0));
	}

	@Test
	void messageFormat() {
		assertEquals("Bad thing. Path 'a'.", JsonPosition.formatMessage(null, "a", "Bad thing"));
		LineInfo lineInfo = new LineInfo() {
			@Override
			public boolean hasLineInfo() {
				return true;
			}

			@Override
			public int lineNumber() {
				return 3;
			}

			@Override
			public int linePosition() {
				return 9;
			}
		};
		assertEquals("Bad thing. Path '[1]', line 3, position 9.", JsonPosition.formatMessage(lineInfo, "[1]", "Bad thing."));
	}
}
