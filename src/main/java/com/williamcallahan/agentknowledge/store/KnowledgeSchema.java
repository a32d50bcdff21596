package com.williamcallahan.agentknowledge.store;

import java.util.List;
import java.util.Locale;

/**
 * PostgreSQL DDL for the knowledge store. Every statement is idempotent.
 */
public final class KnowledgeSchema {

    private KnowledgeSchema() {}

    /**
     * Returns the statements that create extensions, tables, and indexes.
     *
     * @param dimensions embedding vector dimension
     * @param textSearchConfig text search configuration name, already validated as an identifier
     * @return DDL statements in execution order
     */
    public static List<String> statements(int dimensions, String textSearchConfig) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
        return List.of(
                "create extension if not exists pgcrypto",
                "create extension if not exists vector",
                String.format(
                        Locale.ROOT,
                        """
                        create table if not exists entries (
                          id uuid primary key default gen_random_uuid(),
                          type text not null check (type in ('bug','solution','doc')),
                          title text not null,
                          body text,
                          stack_trace text,
                          code text,
                          repro_steps text,
                          root_cause text,
                          resolution text,
                          severity text check (severity in ('low','medium','high','critical')),
                          tags text[] not null default '{}',
                          project text,
                          repo text,
                          "commit" text,
                          branch text,
                          os text,
                          runtime text,
                          language text,
                          framework text,
                          resolved boolean not null default false,
                          content_hash text not null,
                          created_at timestamptz not null default now(),
                          search_vector tsvector generated always as (
                            setweight(to_tsvector('%1$s', coalesce(title, '')), 'A') ||
                            setweight(to_tsvector('%1$s', coalesce(body, '')), 'B') ||
                            setweight(to_tsvector('%1$s', coalesce(code, '')), 'B') ||
                            setweight(to_tsvector('%1$s', coalesce(stack_trace, '')), 'A')
                          ) stored
                        )""",
                        textSearchConfig),
                "create index if not exists idx_entries_search_vector on entries using gin (search_vector)",
                "create index if not exists idx_entries_tags on entries using gin (tags)",
                "create index if not exists idx_entries_project_repo on entries (project, repo)",
                "create index if not exists idx_entries_created_at on entries (created_at desc)",
                "create unique index if not exists idx_entries_content_hash on entries (content_hash)",
                """
                create table if not exists links (
                  from_entry_id uuid not null references entries(id) on delete cascade,
                  to_entry_id uuid not null references entries(id) on delete cascade,
                  relation text not null,
                  created_at timestamptz not null default now(),
                  primary key (from_entry_id, to_entry_id, relation)
                )""",
                String.format(
                        Locale.ROOT,
                        """
                        create table if not exists embeddings (
                          entry_id uuid not null references entries(id) on delete cascade,
                          chunk_id int not null,
                          chunk_text text not null,
                          embedding vector(%d) not null,
                          created_at timestamptz not null default now(),
                          primary key (entry_id, chunk_id)
                        )""",
                        dimensions),
                "create index if not exists idx_embeddings_vector on embeddings"
                        + " using hnsw (embedding vector_ip_ops) with (m = 16, ef_construction = 64)");
    }
}
