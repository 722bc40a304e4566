package org.qargs;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.qargs.usage.UsageGroup;

/** Tests registration rules of {@link ArgumentRegistry} and the {@link ArgumentSet}s it produces */
public class ArgumentRegistryTest {
	private ArgumentRegistry theRegistry;

	/** Creates a registry that generates "no-" inverses */
	@Before
	public void setup() {
		theRegistry = new ArgumentRegistry(ArgConfig.DEFAULT.withInverseGenerator(InverseGenerator.prefixed("no-")));
	}

	private Arg<String> positional(String name, Requirement<String> requirement, boolean multi) {
		return theRegistry.addPositional(name, null, null, requirement, ValueParsers.IDENTITY, null, Accumulator.discard(), multi, null);
	}

	private Arg<String> option(String name, String shortName) {
		return theRegistry.addOption(name, null, null, null, shortName, null, null, ValueParsers.IDENTITY, null, Accumulator.discard());
	}

	private Arg<Boolean> flag(String name, FlagInverse inverse) {
		return theRegistry.addOption(name, null, null, null, null, inverse, false, ValueParsers.BOOLEAN, null, Accumulator.discard());
	}

	private static void assertDefinitionError(String name, Runnable registration) {
		try {
			registration.run();
			Assert.fail("Expected registration of " + name + " to fail");
		} catch (ArgDefinitionException e) {
			Assert.assertEquals(name, e.getName());
		}
	}

	@Test
	public void testMandatoryAfterOptional() {
		positional("a", null, false);
		positional("b", Requirement.optional("x"), false);
		assertDefinitionError("c", () -> positional("c", Requirement.mandatory(), false));
		// Optional after optional is fine
		positional("d", Requirement.optional(null), false);
	}

	@Test
	public void testNothingAfterMulti() {
		positional("a", null, true);
		assertDefinitionError("b", () -> positional("b", Requirement.optional(null), false));
	}

	@Test
	public void testDuplicates() {
		positional("a", null, false);
		assertDefinitionError("a", () -> positional("a", null, false));

		option("opt", "o");
		assertDefinitionError("opt", () -> option("opt", null));
		assertDefinitionError("o", () -> option("other", "o"));
		assertDefinitionError("xy", () -> option("other", "xy"));
		assertDefinitionError("", () -> option("", null));
	}

	@Test
	public void testInverseCollisions() {
		option("no-a", null);
		// The generated inverse of "a" collides with the option
		assertDefinitionError("no-a", () -> flag("a", FlagInverse.AUTO));
		flag("a", FlagInverse.DISABLED);

		flag("b", FlagInverse.named("not-b"));
		assertDefinitionError("not-b", () -> option("not-b", null));
		assertDefinitionError("c", () -> flag("c", FlagInverse.named("c")));
	}

	@Test
	public void testResolvedInverses() {
		flag("a", FlagInverse.AUTO);
		flag("b", FlagInverse.named("off-b"));
		flag("c", FlagInverse.DISABLED);
		option("d", null);

		ArgumentSet args = theRegistry.getArgs();
		Assert.assertEquals("no-a", args.getOption("a").getFlag().getInverse());
		Assert.assertSame(args.getOption("a"), args.getOption("no-a"));
		Assert.assertEquals("off-b", args.getOption("b").getFlag().getInverse());
		Assert.assertNull(args.getOption("c").getFlag().getInverse());
		Assert.assertNull(args.getOption("d").getFlag());
		Assert.assertFalse(args.getOption("d").isFlag());
	}

	@Test
	public void testSecondCommandSet() {
		theRegistry.addCommands(ValueParsers.IDENTITY, ValuePrinter.toStringPrinter());
		assertDefinitionError("command", () -> theRegistry.addCommands(ValueParsers.IDENTITY, ValuePrinter.toStringPrinter()));
	}

	@Test
	public void testDuplicateCommand() {
		ArgumentRegistry.CommandSetRegistry<String> commands = theRegistry.addCommands(ValueParsers.IDENTITY,
			ValuePrinter.toStringPrinter());
		commands.addCommand("a", null, null);
		assertDefinitionError("a", () -> commands.addCommand("a", "again", null));
	}

	@Test
	public void testUsageGroups() {
		UsageGroup group = theRegistry.createUsageGroup("Advanced");
		Assert.assertEquals("Advanced", group.getName());
		Assert.assertTrue(theRegistry.getUsageGroups().contains(new UsageGroup("Advanced")));
		assertDefinitionError("Advanced", () -> theRegistry.createUsageGroup("Advanced"));
	}

	/** Snapshots are frozen and do not see later registrations */
	@Test
	public void testFrozenSnapshot() {
		positional("a", null, false);
		ArgumentSet snapshot = theRegistry.getArgs();
		Assert.assertFalse(snapshot.isMutable());
		positional("b", null, false);

		Assert.assertEquals(1, snapshot.getPositionals().size());
		Assert.assertEquals(2, theRegistry.getArgs().getPositionals().size());
		try {
			snapshot.putShort('x', "a");
			Assert.fail("Expected a frozen set to reject modification");
		} catch (UnsupportedOperationException e) {
			Assert.assertEquals("Cannot modify unmodifiable ArgumentSet", e.getMessage());
		}
		Assert.assertSame(snapshot, ArgumentSet.unmodifiable(snapshot));
	}

	/** A command inherits what its parent had when the command was added, not what the parent registers later */
	@Test
	public void testCommandInheritanceSnapshot() {
		option("early", "e");
		ArgumentRegistry.CommandSetRegistry<String> commands = theRegistry.addCommands(ValueParsers.IDENTITY,
			ValuePrinter.toStringPrinter());
		ArgumentRegistry.AddedCommand added = commands.addCommand("cmd", "Does it", null);
		option("late", null);
		added.getRegistry().addOption("own", null, null, null, null, null, null, ValueParsers.IDENTITY, null, Accumulator.discard());

		ArgumentSet commandArgs = added.getCommand().getArgs();
		Assert.assertFalse(commandArgs.isMutable());
		Assert.assertNotNull(commandArgs.getOption("early"));
		Assert.assertEquals("early", commandArgs.getShortToLong().get('e'));
		Assert.assertNull(commandArgs.getOption("late"));
		Assert.assertNotNull(commandArgs.getOption("own"));
		Assert.assertTrue(commandArgs.getCommands().isEmpty());
		Assert.assertNull(theRegistry.getArgs().getOption("own"));
		// Inherited definitions share their holders with the parent
		Assert.assertSame(theRegistry.getArgs().getOption("early"), commandArgs.getOption("early"));
		Assert.assertEquals("Does it", added.getCommand().getDescription());
		Assert.assertEquals(Definition.Kind.COMMAND, added.getCommand().getKind());
	}

	@Test
	public void testAllDefinitions() {
		positional("pos", null, false);
		flag("f", FlagInverse.AUTO);
		option("o", null);
		theRegistry.addCommands(ValueParsers.IDENTITY, ValuePrinter.toStringPrinter()).addCommand("cmd", null, null);

		List<Map.Entry<String, Definition>> all = theRegistry.getArgs().allDefinitions(false);
		Assert.assertEquals(Arrays.asList("cmd", "pos", "f", "o"), names(all));
		Assert.assertEquals(Arrays.asList("cmd", "pos", "f", "no-f", "o"), names(theRegistry.getArgs().allDefinitions(true)));
	}

	private static List<String> names(List<Map.Entry<String, Definition>> entries) {
		String[] names = new String[entries.size()];
		for (int i = 0; i < names.length; i++)
			names[i] = entries.get(i).getKey();
		return Arrays.asList(names);
	}

	@Test
	public void testSubCommandRegistry() {
		flag("verbose", FlagInverse.AUTO);
		ArgumentRegistry sub = ArgumentRegistry.subCommand(theRegistry);
		Assert.assertSame(theRegistry.getConfig(), sub.getConfig());
		Assert.assertNotNull(sub.getArgs().getOption("no-verbose"));
	}

	/** An empty inverse name or inverse prefix is a registration error */
	@Test
	public void testEmptyInverseNames() {
		assertDefinitionError("", () -> FlagInverse.named(""));
		assertDefinitionError("null", () -> FlagInverse.named(null));
		assertDefinitionError("", () -> InverseGenerator.prefixed(""));
	}
}
