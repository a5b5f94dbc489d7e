package works.lattice.codec.async;

import works.lattice.codec.JsonWriter;

@FunctionalInterface
public interface WriterOperation {
	void apply(JsonWriter writer);
}
