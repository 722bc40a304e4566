package org.qargs.usage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.qargs.CommandDefinition;

/** The chain of commands leading to the scope whose usage is printed, e.g. "a" then "b" for <code>myapp a b</code> */
public final class UsageContext {
	/** The root scope */
	public static final UsageContext ROOT = new UsageContext(Collections.emptyList());

	private final List<CommandDefinition> thePath;

	private UsageContext(List<CommandDefinition> path) {
		thePath = Collections.unmodifiableList(path);
	}

	/** @return The commands from the root to this scope */
	public List<CommandDefinition> getPath() {
		return thePath;
	}

	/**
	 * @param command The command within this scope
	 * @return The context for the command's scope
	 */
	public UsageContext subCommand(CommandDefinition command) {
		List<CommandDefinition> path = new ArrayList<>(thePath.size() + 1);
		path.addAll(thePath);
		path.add(command);
		return new UsageContext(path);
	}
}
