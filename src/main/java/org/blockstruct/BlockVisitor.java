package org.blockstruct;

/**
 * One method per block kind. Adding a kind adds a method here, so every consumer has to handle it.
 */
public interface BlockVisitor<R> {
    R visitBasic(BasicBlock block);

    R visitSequence(SequenceBlock block);

    R visitIfThen(IfThenBlock block);

    R visitIfElse(IfElseBlock block);
}
