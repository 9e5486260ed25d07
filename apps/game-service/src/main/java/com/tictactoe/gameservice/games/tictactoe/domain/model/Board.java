package com.tictactoe.gameservice.games.tictactoe.domain.model;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 井字棋棋盘：3x3 网格，不可变。
 * 落子通过 {@link #with(int, int, Mark)} 返回新棋盘，原棋盘不受影响，
 * 这样 AI 搜索和规则层都可以放心地共享同一个实例。
 */
@EqualsAndHashCode
public final class Board {
    /** 棋盘边长（3x3） */
    public static final int SIZE = 3;

    private static final Board EMPTY_BOARD = new Board(emptyCells());

    /** 行优先展开：index = row * SIZE + col */
    private final Mark[] cells;

    private Board(Mark[] cells) {
        this.cells = cells;
    }

    /** 空棋盘 */
    public static Board empty() {
        return EMPTY_BOARD;
    }

    /**
     * 由二维数组构造（会做拷贝）。
     * @throws IllegalArgumentException 尺寸不是 3x3 或含 null
     */
    public static Board of(Mark[][] grid) {
        if (grid == null || grid.length != SIZE) {
            throw new IllegalArgumentException("棋盘必须为 3 行");
        }
        Mark[] c = new Mark[SIZE * SIZE];
        for (int r = 0; r < SIZE; r++) {
            if (grid[r] == null || grid[r].length != SIZE) {
                throw new IllegalArgumentException("第 " + r + " 行必须为 3 列");
            }
            for (int col = 0; col < SIZE; col++) {
                if (grid[r][col] == null) {
                    throw new IllegalArgumentException("格子 (" + r + "," + col + ") 为空引用");
                }
                c[r * SIZE + col] = grid[r][col];
            }
        }
        return new Board(c);
    }

    /** 是否在棋盘内 */
    public static boolean inBounds(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    /** 读取该格的标记 */
    public Mark get(int row, int col) {
        return cells[row * SIZE + col];
    }

    public Mark get(Position p) {
        return get(p.row(), p.col());
    }

    /** 该格是否为空（越界视为非空） */
    public boolean isEmpty(int row, int col) {
        return inBounds(row, col) && get(row, col) == Mark.EMPTY;
    }

    /**
     * 在 (row,col) 放置 mark，返回新棋盘。
     * 不判断合法性（是否越界/是否已占），由规则层去做。
     */
    public Board with(int row, int col, Mark mark) {
        Mark[] next = cells.clone();
        next[row * SIZE + col] = mark;
        return new Board(next);
    }

    /** 某种标记的数量 */
    public int count(Mark mark) {
        int n = 0;
        for (Mark c : cells) if (c == mark) n++;
        return n;
    }

    /** 棋盘是否已满 */
    public boolean isFull() {
        return count(Mark.EMPTY) == 0;
    }

    /** 所有空格，行优先（row 0→2，col 0→2） */
    public List<Position> emptyPositions() {
        List<Position> list = new ArrayList<>(SIZE * SIZE);
        for (int r = 0; r < SIZE; r++) {
            for (int c = 0; c < SIZE; c++) {
                if (get(r, c) == Mark.EMPTY) list.add(new Position(r, c));
            }
        }
        return list;
    }

    /** 返回一个二维副本（用于序列化/日志） */
    public Mark[][] view() {
        Mark[][] v = new Mark[SIZE][SIZE];
        for (int r = 0; r < SIZE; r++) {
            v[r] = Arrays.copyOfRange(cells, r * SIZE, (r + 1) * SIZE);
        }
        return v;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(SIZE * (SIZE + 1));
        for (int r = 0; r < SIZE; r++) {
            if (r > 0) sb.append('/');
            for (int c = 0; c < SIZE; c++) {
                Mark m = get(r, c);
                sb.append(m == Mark.EMPTY ? '.' : m.symbol().charAt(0));
            }
        }
        return sb.toString();
    }

    private static Mark[] emptyCells() {
        Mark[] c = new Mark[SIZE * SIZE];
        Arrays.fill(c, Mark.EMPTY);
        return c;
    }
}
