package works.lattice.tree;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

/**
 * Options for building a tree from a {@link works.lattice.codec.JsonReader}.
 */
@Value
@Builder(toBuilder = true)
public class LoadSettings {
	public static final LoadSettings DEFAULT = LoadSettings.builder().build();

	@Default CommentHandling commentHandling = CommentHandling.IGNORE;
	@Default LineInfoHandling lineInfoHandling = LineInfoHandling.LOAD;
	@Default DuplicatePropertyNameHandling duplicatePropertyNameHandling = DuplicatePropertyNameHandling.REPLACE;

	public enum CommentHandling {
		IGNORE,

		/**
		 * Comments become {@link NodeType#COMMENT} values.
		 * Comments directly inside an object are still dropped, since objects hold only properties.
		 */
		LOAD,
	}

	public enum LineInfoHandling {
		/**
		 * Record the line and position of each node, if the reader provides them.
		 */
		LOAD,
		IGNORE,
	}

	public enum DuplicatePropertyNameHandling {
		/**
		 * The later property takes the place of the earlier one.
		 */
		REPLACE,

		/**
		 * The later property is skipped.
		 */
		IGNORE,

		/**
		 * A {@link works.lattice.exceptions.JsonReaderException} is thrown.
		 */
		ERROR,
	}
}
