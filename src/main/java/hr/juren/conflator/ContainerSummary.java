package hr.juren.conflator;

public record ContainerSummary(String name, int dirtyCount, int totalEntries) {

    @Override
    public String toString() {
        return "<" + name + " dirty:" + dirtyCount + " entries:" + totalEntries + ">";
    }
}
