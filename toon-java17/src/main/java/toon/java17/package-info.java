/// Reading and writing TOON, Token-Oriented Object Notation.
///
/// {@link toon.java17.Toon} is the entry point. Values are modelled by the
/// sealed {@link toon.java17.ToonValue} hierarchy, writing is configured by
/// {@link toon.java17.ToonOptions}, and every failure is a
/// {@link toon.java17.ToonException}.
///
/// Logging uses `java.util.logging` under the logger names of the classes in
/// this package: `FINE` for each document read or written, `FINER` for layout
/// decisions and the structure found while parsing.
package toon.java17;
