package com.fusestorage;

import com.fusestorage.model.ColumnType;
import com.fusestorage.model.TableDefinition;
import com.fusestorage.record.DatabaseRecord;
import com.fusestorage.record.RecordContract;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Note implements DatabaseRecord<Note> {
    public static final TableDefinition TABLE = TableDefinition.builder("notes")
            .primaryKey("id", ColumnType.TEXT)
            .column("title", ColumnType.TEXT)
            .column("createdAt", ColumnType.DATE)
            .build();

    public static final RecordContract<Note> CONTRACT = RecordContract.builder(Note.class)
            .tableName("notes")
            .tableDefinition(TABLE)
            .factory(Note::new)
            .field("id", String.class, Note::getId, Note::setId)
            .field("title", String.class, Note::getTitle, Note::setTitle)
            .field("createdAt", Instant.class, Note::getCreatedAt, Note::setCreatedAt)
            .build();

    private String id;
    private String title;
    private Instant createdAt;

    @Override
    public RecordContract<Note> contract() {
        return CONTRACT;
    }
}
