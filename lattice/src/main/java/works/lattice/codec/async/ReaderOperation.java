package works.lattice.codec.async;

import works.lattice.codec.JsonReader;

@FunctionalInterface
public interface ReaderOperation<T> {
	T apply(JsonReader reader);
}
