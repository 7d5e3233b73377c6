package work.lcod.infra.graph;

import work.lcod.infra.syntax.SourceRange;

public record Dependency(String name, SourceRange range) {}
