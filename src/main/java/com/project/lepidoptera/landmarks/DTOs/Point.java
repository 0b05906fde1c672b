package com.project.lepidoptera.landmarks.DTOs;

/** Integer pixel coordinate, row first. */
public record Point(int row, int col) {

    public Point translate(int dRow, int dCol) {
        return new Point(row + dRow, col + dCol);
    }

    public long distanceSquaredTo(Point other) {
        long dr = row - other.row, dc = col - other.col;
        return dr * dr + dc * dc;
    }

    public int[] toArray() {
        return new int[]{row, col};
    }
}
