package org.qargs;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

/** Tests the standard {@link Accumulator}s */
public class AccumulatorTest {
	@Test
	public void testDiscard() {
		Accumulator<String, String> discard = Accumulator.discard();
		Assert.assertEquals("b", discard.accumulate("b", "a"));
		Assert.assertEquals("a", discard.accumulate("a", null));
	}

	/** The list accumulator starts from null or from the default, and never modifies the previous list */
	@Test
	public void testList() {
		Accumulator<String, List<String>> list = Accumulator.list();
		List<String> first = list.accumulate("x", null);
		List<String> second = list.accumulate("y", first);
		Assert.assertEquals(Collections.singletonList("x"), first);
		Assert.assertEquals(Arrays.asList("x", "y"), second);
		Assert.assertEquals(Arrays.asList("d", "z"), list.accumulate("z", Collections.singletonList("d")));
		try {
			second.add("z");
			Assert.fail("Accumulated lists should be unmodifiable");
		} catch (UnsupportedOperationException e) {
			// Expected
		}
	}

	@Test
	public void testSet() {
		Accumulator<String, Set<String>> set = Accumulator.set();
		Set<String> value = set.accumulate("b", set.accumulate("a", set.accumulate("b", null)));
		Assert.assertEquals(new LinkedHashSet<>(Arrays.asList("b", "a")), value);
		Assert.assertEquals(Arrays.asList("b", "a"), Arrays.asList(value.toArray()));
	}

	@Test
	public void testFlagCount() {
		Accumulator<Boolean, Integer> count = Accumulator.flagCount();
		Integer value = null;
		for (boolean b : new boolean[] { true, true, false, true })
			value = count.accumulate(b, value);
		Assert.assertEquals(Integer.valueOf(2), value);
		Assert.assertEquals(Integer.valueOf(-1), count.accumulate(false, 0));
	}
}
