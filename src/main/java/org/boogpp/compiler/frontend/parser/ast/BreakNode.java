package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

public record BreakNode(SourceInfo source) implements StatementNode {
}
