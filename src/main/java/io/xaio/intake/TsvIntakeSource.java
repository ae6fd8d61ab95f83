package io.xaio.intake;

import io.xaio.adapter.IntakeItem;
import io.xaio.adapter.IntakeSource;
import io.xaio.adapter.TransientStageException;
import io.xaio.config.IntakeColumnMapping;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Tab-separated export of the intake sheet. A row is new while its status cell is empty. Rows are identified by
 * their item id cell when the mapping has one and it is filled, otherwise by {@code row:<line number>}.
 */
public final class TsvIntakeSource implements IntakeSource {
    private static final String ROW_PREFIX = "row:";

    private final Path file;
    private final int firstDataRow;
    private final IntakeColumnMapping columns;

    public TsvIntakeSource(Path file, int firstDataRow, IntakeColumnMapping columns) {
        this.file = file;
        this.firstDataRow = Math.max(1, firstDataRow);
        this.columns = columns;
    }

    @Override
    public synchronized List<IntakeItem> listNewItems() throws TransientStageException {
        List<String> lines = read();
        List<IntakeItem> out = new ArrayList<>();
        for (int i = firstDataRow - 1; i < lines.size(); i++) {
            String[] cells = cells(lines.get(i));
            String url = cell(cells, columns.urlColumn());
            String status = cell(cells, columns.statusColumn());
            if (url.isEmpty() || !status.isEmpty()) {
                continue;
            }
            out.add(new IntakeItem(externalId(cells, i + 1), url));
        }
        return out;
    }

    @Override
    public synchronized void markStatus(String externalId, String status) throws TransientStageException {
        List<String> lines = new ArrayList<>(read());
        int index = locate(lines, externalId);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown intake row: " + externalId);
        }
        String[] cells = cells(lines.get(index));
        if (cells.length < columns.width()) {
            cells = Arrays.copyOf(cells, columns.width());
        }
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == null) {
                cells[i] = "";
            }
        }
        cells[columns.statusColumn()] = status == null ? "" : status.replace('\t', ' ');
        lines.set(index, String.join("\t", cells));
        write(lines);
    }

    private int locate(List<String> lines, String externalId) {
        if (externalId != null && externalId.startsWith(ROW_PREFIX)) {
            try {
                int row = Integer.parseInt(externalId.substring(ROW_PREFIX.length()));
                return row >= firstDataRow && row <= lines.size() ? row - 1 : -1;
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        if (columns.itemIdColumn() < 0) {
            return -1;
        }
        for (int i = firstDataRow - 1; i < lines.size(); i++) {
            if (cell(cells(lines.get(i)), columns.itemIdColumn()).equals(externalId)) {
                return i;
            }
        }
        return -1;
    }

    private String externalId(String[] cells, int lineNumber) {
        if (columns.itemIdColumn() >= 0) {
            String id = cell(cells, columns.itemIdColumn());
            if (!id.isEmpty()) {
                return id;
            }
        }
        return ROW_PREFIX + lineNumber;
    }

    private List<String> read() throws TransientStageException {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TransientStageException("Failed to read intake file: " + file, e);
        }
    }

    private void write(List<String> lines) throws TransientStageException {
        try {
            Path tmp = Files.createTempFile(file.toAbsolutePath().getParent(), ".intake-", ".tsv");
            try {
                Files.write(tmp, lines, StandardCharsets.UTF_8);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new TransientStageException("Failed to write intake file: " + file, e);
        }
    }

    private static String[] cells(String line) {
        return line.split("\t", -1);
    }

    private static String cell(String[] cells, int index) {
        if (index < 0 || index >= cells.length || cells[index] == null) {
            return "";
        }
        return cells[index].trim();
    }
}
