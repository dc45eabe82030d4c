package github.sarthakdev143.matte_embed.model.image;

public record DataWindow(int minX, int minY, int maxX, int maxY) {

    public int width() {
        return maxX - minX + 1;
    }

    public int height() {
        return maxY - minY + 1;
    }
}
