package org.qargs;

import java.util.Collections;

import org.junit.Assert;
import org.junit.Test;

/** Tests {@link PrefixInverseGenerator} and the simple {@link InverseGenerator}s */
public class PrefixInverseGeneratorTest {
	@Test
	public void testDefaultPairs() {
		PrefixInverseGenerator gen = new PrefixInverseGenerator();
		Assert.assertEquals("without-a", gen.generate("with-a"));
		Assert.assertEquals("with-a", gen.generate("without-a"));
		Assert.assertEquals("disable-b", gen.generate("enable-b"));
		Assert.assertEquals("enable-b", gen.generate("disable-b"));
		Assert.assertEquals("no-c", gen.generate("c"));
		Assert.assertEquals("no-within", gen.generate("within"));
		// A bare prefix is not swapped
		Assert.assertEquals("no-with-", gen.generate("with-"));
	}

	@Test
	public void testCustomPairs() {
		PrefixInverseGenerator gen = new PrefixInverseGenerator(Collections.singletonMap("allow-", "deny-"), "skip-");
		Assert.assertEquals("deny-x", gen.generate("allow-x"));
		Assert.assertEquals("skip-deny-x", gen.generate("deny-x"));
		Assert.assertEquals("skip-with-a", gen.generate("with-a"));
		Assert.assertEquals("skip-", gen.getFallback());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyFallback() {
		new PrefixInverseGenerator(PrefixInverseGenerator.defaultPairs(), "");
	}

	@Test
	public void testSimpleGenerators() {
		Assert.assertNull(InverseGenerator.NONE.generate("a"));
		Assert.assertEquals("no-a", InverseGenerator.prefixed("no-").generate("a"));
	}
}
