package works.strata.schema;

import java.util.List;
import java.util.function.Consumer;
import works.strata.exceptions.UnresolvedFormatException;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * One type expression: a scalar, a composite of other expressions,
 * or a {@link TypeName reference} to a named entry of a {@link Registry}.
 * <p>
 * All composites are structurally finite. The only way to express a
 * recursive type is through a {@link TypeName}, which is resolved by name,
 * not by structural identity.
 */
public sealed interface Format permits
	Format.Primitive,
	Format.OptionFormat,
	Format.SeqFormat,
	Format.MapFormat,
	Format.TupleFormat,
	Format.FixedArrayFormat,
	Format.TypeName,
	Format.Unresolved
{
	/**
	 * Post-order traversal: each child is visited before its parent.
	 *
	 * @throws UnresolvedFormatException if the tree contains an {@link Unresolved} placeholder
	 */
	void visit(Consumer<? super Format> visitor);

	/**
	 * @return a deterministic identifier describing this format,
	 * suitable for naming helper functions in generated code.
	 * There are no uniqueness guarantees beyond structural equality.
	 */
	String mangledName();

	enum Primitive implements Format {
		UNIT, BOOL,
		I8, I16, I32, I64, I128,
		U8, U16, U32, U64, U128,
		F32, F64,
		CHAR, STR, BYTES;

		@Override
		public void visit(Consumer<? super Format> visitor) {
			visitor.accept(this);
		}

		@Override
		public String mangledName() {
			return name().toLowerCase();
		}
	}

	record OptionFormat(Format content) implements Format {
		public OptionFormat {
			requireNonNull(content);
		}

		@Override
		public void visit(Consumer<? super Format> visitor) {
			content.visit(visitor);
			visitor.accept(this);
		}

		@Override
		public String mangledName() {
			return "option_" + content.mangledName();
		}
	}

	/**
	 * A variable-length homogeneous sequence.
	 */
	record SeqFormat(Format content) implements Format {
		public SeqFormat {
			requireNonNull(content);
		}

		@Override
		public void visit(Consumer<? super Format> visitor) {
			content.visit(visitor);
			visitor.accept(this);
		}

		@Override
		public String mangledName() {
			return "vector_" + content.mangledName();
		}
	}

	/**
	 * An association with unique keys.
	 */
	record MapFormat(Format key, Format value) implements Format {
		public MapFormat {
			requireNonNull(key);
			requireNonNull(value);
		}

		@Override
		public void visit(Consumer<? super Format> visitor) {
			key.visit(visitor);
			value.visit(visitor);
			visitor.accept(this);
		}

		@Override
		public String mangledName() {
			return "map_" + key.mangledName() + "_to_" + value.mangledName();
		}
	}

	record TupleFormat(List<Format> formats) implements Format {
		public TupleFormat {
			formats = List.copyOf(formats);
		}

		public static TupleFormat of(Format... formats) {
			return new TupleFormat(List.of(formats));
		}

		@Override
		public void visit(Consumer<? super Format> visitor) {
			formats.forEach(f -> f.visit(visitor));
			visitor.accept(this);
		}

		@Override
		public String mangledName() {
			return "tuple" + formats.size() + "_" + formats.stream()
				.map(Format::mangledName)
				.collect(joining("_"));
		}
	}

	/**
	 * A homogeneous sequence whose length is part of the type.
	 */
	record FixedArrayFormat(Format content, int size) implements Format {
		public FixedArrayFormat {
			requireNonNull(content);
			if (size < 0) {
				throw new IllegalArgumentException("Negative array size: " + size);
			}
		}

		@Override
		public void visit(Consumer<? super Format> visitor) {
			content.visit(visitor);
			visitor.accept(this);
		}

		@Override
		public String mangledName() {
			return "array" + size + "_" + content.mangledName() + "_array";
		}
	}

	/**
	 * A reference to another entry of the {@link Registry}.
	 */
	record TypeName(String name) implements Format {
		public TypeName {
			requireNonNull(name);
		}

		@Override
		public void visit(Consumer<? super Format> visitor) {
			visitor.accept(this);
		}

		@Override
		public String mangledName() {
			return name;
		}

		@Override
		public String toString() {
			return "@" + name;
		}
	}

	/**
	 * A placeholder that the schema producer failed to fill in.
	 * Any attempt to traverse it fails.
	 */
	record Unresolved() implements Format {
		@Override
		public void visit(Consumer<? super Format> visitor) {
			throw new UnresolvedFormatException("Unresolved format placeholder");
		}

		@Override
		public String mangledName() {
			throw new UnresolvedFormatException("Unresolved format placeholder");
		}
	}

	static Format option(Format content) {
		return new OptionFormat(content);
	}

	static Format seq(Format content) {
		return new SeqFormat(content);
	}

	static Format map(Format key, Format value) {
		return new MapFormat(key, value);
	}

	static Format tuple(Format... formats) {
		return TupleFormat.of(formats);
	}

	static Format array(Format content, int size) {
		return new FixedArrayFormat(content, size);
	}

	static Format typeName(String name) {
		return new TypeName(name);
	}
}
