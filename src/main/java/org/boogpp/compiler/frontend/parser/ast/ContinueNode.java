package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

public record ContinueNode(SourceInfo source) implements StatementNode {
}
