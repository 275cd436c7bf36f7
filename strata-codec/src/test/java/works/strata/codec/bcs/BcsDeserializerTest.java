package works.strata.codec.bcs;

import java.util.HexFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.strata.codec.Slice;
import works.strata.codec.exceptions.DeserializationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BcsDeserializerTest {

	@Test
	void uleb128() {
		assertEquals(0, deserializer("00").deserializeVariantIndex());
		assertEquals(0x80, deserializer("8001").deserializeVariantIndex());
		assertEquals(300, deserializer("ac02").deserializeLen());
		assertEquals(-1, deserializer("ffffffff0f").deserializeVariantIndex());
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"8000",         // zero written with two digits
		"ff00",         // trailing zero digit
		"8080808000",   // five digits, last one zero
		"ffffffff1f",   // exceeds 32 bits
		"ffffffffff01", // too many digits
		"80",           // truncated
		""
	})
	void rejectsNonCanonicalUleb128(String input) {
		assertThrows(DeserializationException.class, () -> deserializer(input).deserializeVariantIndex());
	}

	@Test
	void lengthLimit() {
		assertEquals(Integer.MAX_VALUE, deserializer("ffffffff07").deserializeLen());
		assertThrows(DeserializationException.class, () -> deserializer("ffffffff08").deserializeLen());
	}

	@Test
	void bytesLongerThanInput() {
		assertThrows(DeserializationException.class, () -> deserializer("05616263").deserializeBytes());
	}

	@Test
	void keySlices() {
		var deserializer = deserializer("0102020103");
		deserializer.checkThatKeySlicesAreIncreasing(new Slice(0, 1), new Slice(1, 2));
		deserializer.checkThatKeySlicesAreIncreasing(new Slice(3, 4), new Slice(1, 3));
		assertThrows(DeserializationException.class, () ->
			deserializer.checkThatKeySlicesAreIncreasing(new Slice(1, 2), new Slice(2, 3)));
		assertThrows(DeserializationException.class, () ->
			deserializer.checkThatKeySlicesAreIncreasing(new Slice(1, 3), new Slice(1, 2)));
	}

	@Test
	void strictBooleans() {
		assertTrue(deserializer("01").deserializeBool());
		assertThrows(DeserializationException.class, () -> deserializer("02").deserializeBool());
		assertThrows(DeserializationException.class, () -> deserializer("ff").deserializeOptionTag());
	}

	@Test
	void strictUtf8() {
		assertEquals("é", deserializer("02c3a9").deserializeStr());
		assertThrows(DeserializationException.class, () -> deserializer("01ff").deserializeStr());
		assertThrows(DeserializationException.class, () -> deserializer("02c0af").deserializeStr(), "Overlong");
		assertThrows(DeserializationException.class, () -> deserializer("03eda080").deserializeStr(), "Surrogate");
	}

	private static BcsDeserializer deserializer(String hex) {
		return new BcsDeserializer(HexFormat.of().parseHex(hex));
	}
}
