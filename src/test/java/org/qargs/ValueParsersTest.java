package org.qargs;

import java.text.ParseException;
import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

/** Tests {@link ValueParsers} and {@link ValueParser} composition */
public class ValueParsersTest {
	private static void assertRejects(ValueParser<?> parser, String text, String reason) {
		try {
			parser.parse(text);
			Assert.fail("Expected \"" + text + "\" to be rejected");
		} catch (ParseException e) {
			Assert.assertEquals(reason, e.getMessage());
		}
	}

	@Test
	public void testNumbers() throws ParseException {
		Assert.assertEquals(Integer.valueOf(-12), ValueParsers.INT.parse("-12"));
		Assert.assertEquals(Integer.valueOf(255), ValueParsers.ints(16).parse("ff"));
		Assert.assertEquals(Long.valueOf(10000000000L), ValueParsers.LONG.parse("10000000000"));
		Assert.assertEquals(2.5, ValueParsers.DOUBLE.parse("2.5"), 0.0);
		assertRejects(ValueParsers.INT, "1.5", "Invalid int");
		assertRejects(ValueParsers.LONG, "x", "Invalid long");
		assertRejects(ValueParsers.DOUBLE, "x", "Invalid number");
	}

	@Test
	public void testBoolean() throws ParseException {
		Assert.assertTrue(ValueParsers.BOOLEAN.parse("true"));
		Assert.assertFalse(ValueParsers.BOOLEAN.parse("false"));
		assertRejects(ValueParsers.BOOLEAN, "True", "Value not in available choices: true, false");
		Assert.assertTrue(ValueParsers.negateFlag(ValueParsers.BOOLEAN).parse("false"));
	}

	enum Mode {
		FAST, SAFE
	}

	@Test
	public void testEnums() throws ParseException {
		Assert.assertEquals(Mode.SAFE, ValueParsers.enumChoice(Mode.class).parse("SAFE"));
		assertRejects(ValueParsers.enumChoice(Mode.class), "safe", "Value not in available choices: FAST, SAFE");
		Assert.assertEquals(Mode.FAST, ValueParsers.enumChoice(Mode.class, name -> name.toLowerCase()).parse("fast"));
	}

	@Test
	public void testChoice() throws ParseException {
		ValueParser<Integer> levels = ValueParsers.choice(Arrays.asList(1, 2, 3), ValueParsers.INT);
		Assert.assertEquals(Integer.valueOf(2), levels.parse("2"));
		assertRejects(levels, "4", "Value not in available choices: 1, 2, 3");
		// The unconstrained parser's errors come first
		assertRejects(levels, "x", "Invalid int");

		ValueParser<Mode> printed = ValueParsers.enumChoice(Mode.class).choice(Arrays.asList(Mode.FAST), mode -> mode.name().toLowerCase());
		assertRejects(printed, "SAFE", "Value not in available choices: fast");
	}

	@Test
	public void testThen() throws ParseException {
		ValueParser<String> upper = ValueParsers.IDENTITY.then(s -> s.toUpperCase());
		Assert.assertEquals("ABC", upper.parse("abc"));

		ValueParser<Integer> even = ValueParsers.INT.then(value -> {
			if (value % 2 != 0)
				throw new ParseException("Must be even", 0);
			return value / 2;
		});
		Assert.assertEquals(Integer.valueOf(3), even.parse("6"));
		assertRejects(even, "7", "Must be even");
	}
}
