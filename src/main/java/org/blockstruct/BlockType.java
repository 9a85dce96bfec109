package org.blockstruct;

public enum BlockType {
    BASIC,
    SEQUENCE,
    IF_THEN,
    IF_ELSE
}
