package works.strata.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.strata.codec.interpreter.LayoutInterpretingDecoder;
import works.strata.codec.interpreter.LayoutInterpretingEncoder;
import works.strata.exceptions.UndefinedTypeException;
import works.strata.layout.LayoutPlan;
import works.strata.schema.Format;
import works.strata.schema.Format.TypeName;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link Codec} according to the user's instructions.
 */
public class CodecBuilder {
	private final LayoutPlan plan;
	private Encoding encoding = Encoding.BCS;

	private CodecBuilder(LayoutPlan plan) {
		this.plan = requireNonNull(plan);
	}

	/**
	 * @param plan is used to resolve any {@link TypeName}s
	 */
	public static CodecBuilder using(LayoutPlan plan) {
		return new CodecBuilder(plan);
	}

	/**
	 * Defaults to {@link Encoding#BCS}.
	 */
	public CodecBuilder encoding(Encoding encoding) {
		this.encoding = requireNonNull(encoding);
		return this;
	}

	public Codec build() {
		LOGGER.debug("Building {} codec for {}", encoding, plan);
		Encoding encoding = this.encoding;
		return new Codec() {
			@Override
			public Encoding encoding() {
				return encoding;
			}

			@Override
			public Encoder encoderFor(Format format) {
				checkDefined(format);
				return new LayoutInterpretingEncoder(format, plan, encoding);
			}

			@Override
			public Decoder decoderFor(Format format) {
				checkDefined(format);
				return new LayoutInterpretingDecoder(format, plan, encoding);
			}
		};
	}

	private void checkDefined(Format format) {
		format.visit(f -> {
			if (f instanceof TypeName t && !plan.registry().contains(t.name())) {
				throw new UndefinedTypeException(t.name());
			}
		});
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CodecBuilder.class);
}
