package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

public record PassNode(SourceInfo source) implements StatementNode {
}
