module works.ordmap.core {
	requires static lombok;
	requires static org.jetbrains.annotations;
	requires org.slf4j;

	exports works.ordmap;
	exports works.ordmap.exceptions;
}
