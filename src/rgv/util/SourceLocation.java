package rgv.util;

import java.nio.file.Path;
import java.util.Objects;

public class SourceLocation implements Comparable<SourceLocation> {
	private final Path file;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	/**
	 * Lines and columns are 0-based, as delivered by the parser.
	 */
	public SourceLocation(Path file, int startLine, int endLine, int startColumn, int endColumn) {
		this.file = file;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return file == null;
	}

	public String prettyString() {
		if (isUnknown()) {
			return "at unknown source location";
		}
		StringBuilder b = new StringBuilder("at ");
		if (startLine != endLine) {
			b.append(startLine + 1).append(':').append(startColumn + 1)
					.append('-').append(endLine + 1).append(':').append(endColumn);
		} else if (startColumn != endColumn) {
			b.append(startLine + 1).append(':').append(startColumn + 1).append('-').append(endColumn);
		} else {
			b.append(startLine + 1).append(':').append(startColumn + 1);
		}
		b.append(" in file ").append(file);
		return b.toString();
	}

	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		if (!file.equals(other.file)) {
			throw new IllegalArgumentException(
					"Tried to combine source locations from two different files: " + file + ", " + other.file);
		}
		int mStartColumn;
		if (startLine == other.startLine) {
			mStartColumn = Integer.min(startColumn, other.startColumn);
		} else {
			mStartColumn = startLine < other.startLine ? startColumn : other.startColumn;
		}
		int mEndColumn;
		if (endLine == other.endLine) {
			mEndColumn = Integer.max(endColumn, other.endColumn);
		} else {
			mEndColumn = endLine > other.endLine ? endColumn : other.endColumn;
		}
		return new SourceLocation(file, Integer.min(startLine, other.startLine),
				Integer.max(endLine, other.endLine), mStartColumn, mEndColumn);
	}

	public Path getFile() {
		return file;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return startLine == other.startLine && endLine == other.endLine && startColumn == other.startColumn &&
				endColumn == other.endColumn && Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		}
		return "SourceLocation [file=" + file + ", startLine=" + startLine + ", endLine=" + endLine +
				", startColumn=" + startColumn + ", endColumn=" + endColumn + "]";
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int compared = file.compareTo(o.file);
		if (compared != 0) {
			return compared;
		}
		compared = Integer.compare(startLine, o.startLine);
		if (compared != 0) {
			return compared;
		}
		compared = Integer.compare(startColumn, o.startColumn);
		if (compared != 0) {
			return compared;
		}
		compared = Integer.compare(endLine, o.endLine);
		if (compared != 0) {
			return compared;
		}
		return Integer.compare(endColumn, o.endColumn);
	}
}
