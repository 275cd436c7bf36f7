package works.strata.codec;

import works.strata.codec.bcs.BcsDeserializer;
import works.strata.codec.bcs.BcsSerializer;
import works.strata.codec.bincode.BincodeDeserializer;
import works.strata.codec.bincode.BincodeSerializer;

/**
 * The binary encodings a {@link Codec} can use.
 */
public enum Encoding {
	BINCODE {
		@Override
		public Serializer newSerializer() {
			return new BincodeSerializer();
		}

		@Override
		public Deserializer newDeserializer(byte[] input) {
			return new BincodeDeserializer(input);
		}

		@Override
		public boolean isCanonical() {
			return false;
		}
	},

	BCS {
		@Override
		public Serializer newSerializer() {
			return new BcsSerializer();
		}

		@Override
		public Deserializer newDeserializer(byte[] input) {
			return new BcsDeserializer(input);
		}

		@Override
		public boolean isCanonical() {
			return true;
		}
	};

	public abstract Serializer newSerializer();

	public abstract Deserializer newDeserializer(byte[] input);

	/**
	 * @return true if equal values always encode to identical bytes,
	 * and the decoder rejects every other encoding of them
	 */
	public abstract boolean isCanonical();
}
