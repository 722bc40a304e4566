package org.qargs;

/** An item that has a name */
public interface Named {
	/** @return The name of the item */
	String getName();
}
