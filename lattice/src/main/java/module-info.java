/**
 * Lattice: streaming JSON reading and writing, plus a mutable document tree.
 * <p>
 * The major packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.lattice.codec}, the abstract {@link works.lattice.codec.JsonReader reader}
 *         and {@link works.lattice.codec.JsonWriter writer} with their shared state tracking;
 *     </li>
 *     <li>
 *         {@link works.lattice.codec.io}, which reads and writes JSON text;
 *     </li>
 *     <li>
 *         {@link works.lattice.tree}, the document tree and the reader and writer that bridge it to token streams; and
 *     </li>
 *     <li>
 *         {@link works.lattice.codec.async}, future-returning wrappers around readers and writers.
 *     </li>
 * </ul>
 */
module works.lattice {
	requires org.slf4j;
	requires static lombok;

	exports works.lattice.codec;
	exports works.lattice.codec.io;
	exports works.lattice.codec.async;
	exports works.lattice.tree;
	exports works.lattice.exceptions;
}
