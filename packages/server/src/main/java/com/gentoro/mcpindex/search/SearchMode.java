package com.gentoro.mcpindex.search;

public enum SearchMode {
  SEMANTIC,
  LEXICAL
}
