package me.golemcore.promptforge.domain.model;

/**
 * The two searchable corpora of the knowledge base.
 */
public enum CorpusKind {
    DOCUMENTS, TEMPLATES
}
