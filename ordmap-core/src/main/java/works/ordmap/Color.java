package works.ordmap;

/**
 * The color of the link from a {@link Node} to its parent.
 * A red link glues a node to its parent to form a 3-node.
 */
enum Color {
	RED,
	BLACK;

	Color flipped() {
		return (this == RED) ? BLACK : RED;
	}
}
