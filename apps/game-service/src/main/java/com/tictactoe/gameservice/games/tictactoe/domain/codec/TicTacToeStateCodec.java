package com.tictactoe.gameservice.games.tictactoe.domain.codec;

import com.tictactoe.gameservice.games.tictactoe.domain.dto.GameStateRecord;
import com.tictactoe.gameservice.games.tictactoe.domain.exception.MalformedStateException;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Board;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Difficulty;
import com.tictactoe.gameservice.games.tictactoe.domain.model.GameStatus;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Mark;
import com.tictactoe.gameservice.games.tictactoe.domain.model.Position;
import com.tictactoe.gameservice.games.tictactoe.domain.model.TicTacToeState;
import com.tictactoe.gameservice.games.tictactoe.domain.rule.TicTacToeJudge;

import java.util.ArrayList;
import java.util.List;

/**
 * TicTacToeState 与 GameStateRecord 的互转。
 * - encode / decode 互为逆运算：decode(encode(s)) 与 s 相等；
 * - decode 会完整校验数据模型约束，任何不一致都抛 MalformedStateException，
 *   所以存储层/前端传来的数据一旦通过 decode，后续规则层可以直接信任。
 * 集合一律用 ArrayList：Redis 的 JSON 序列化会写入具体集合类型，不可变集合无法反序列化。
 */
public final class TicTacToeStateCodec {

    private TicTacToeStateCodec() {}

    public static GameStateRecord encode(TicTacToeState s) {
        GameStateRecord rec = new GameStateRecord();

        List<List<String>> rows = new ArrayList<>(Board.SIZE);
        for (int r = 0; r < Board.SIZE; r++) {
            List<String> row = new ArrayList<>(Board.SIZE);
            for (int c = 0; c < Board.SIZE; c++) row.add(s.getBoard().get(r, c).symbol());
            rows.add(row);
        }
        rec.setBoard(rows);
        rec.setCurrentPlayer(s.getTurn().symbol());
        rec.setGameStatus(s.getStatus().wireValue());
        rec.setWinner(s.getWinner() == null ? null : s.getWinner().symbol());
        if (s.getWinningLine() != null) {
            List<List<Integer>> line = new ArrayList<>(3);
            for (Position p : s.getWinningLine()) {
                line.add(new ArrayList<>(List.of(p.row(), p.col())));
            }
            rec.setWinningLine(line);
        }
        rec.setDifficulty(s.getDifficulty().wireValue());
        return rec;
    }

    /**
     * @throws MalformedStateException 尺寸/取值不合法，或状态、赢家、三连、X/O 数量之间不一致
     */
    public static TicTacToeState decode(GameStateRecord rec) {
        if (rec == null) throw malformed("状态为空");

        Board board = decodeBoard(rec.getBoard());
        Mark turn = decodePlayer(rec.getCurrentPlayer(), "currentPlayer");
        GameStatus status = GameStatus.fromWireValue(rec.getGameStatus());
        if (status == null) throw malformed("gameStatus 取值非法: " + rec.getGameStatus());
        Difficulty difficulty = Difficulty.fromWireValue(rec.getDifficulty());
        if (difficulty == null) throw malformed("difficulty 取值非法: " + rec.getDifficulty());
        Mark winner = rec.getWinner() == null ? null : decodePlayer(rec.getWinner(), "winner");
        List<Position> line = decodeLine(rec.getWinningLine());

        // X 先手，且每步都切换执子方：X 数 - O 数 ∈ {0,1}，执子方由差值唯一确定
        int xs = board.count(Mark.X);
        int os = board.count(Mark.O);
        int diff = xs - os;
        if (diff != 0 && diff != 1) {
            throw malformed("X/O 数量不平衡: X=" + xs + ", O=" + os);
        }
        Mark expectedTurn = diff == 0 ? Mark.X : Mark.O;
        if (turn != expectedTurn) {
            throw malformed("currentPlayer 与棋子数量不符: " + turn.symbol());
        }

        switch (status) {
            case PLAYING:
                if (winner != null || line != null) throw malformed("进行中的对局不应有赢家/三连");
                if (TicTacToeJudge.hasAnyLine(board)) throw malformed("棋盘已有三连但状态为进行中");
                if (board.isFull()) throw malformed("棋盘已满但状态为进行中");
                break;
            case WON:
                if (winner == null || line == null) throw malformed("已分胜负的对局缺少赢家/三连");
                if (TicTacToeJudge.ownerOf(board, line) != winner) throw malformed("winningLine 不是赢家的三连");
                if (turn.opponent() != winner) throw malformed("赢家必须是最后落子的一方");
                for (List<Position> l : TicTacToeJudge.LINES) {
                    if (TicTacToeJudge.ownerOf(board, l) == winner.opponent()) {
                        throw malformed("双方同时三连");
                    }
                }
                break;
            case DRAW:
                if (winner != null || line != null) throw malformed("和棋不应有赢家/三连");
                if (!board.isFull()) throw malformed("和棋时棋盘必须已满");
                if (TicTacToeJudge.hasAnyLine(board)) throw malformed("棋盘有三连但状态为和棋");
                break;
            default:
                throw malformed("未知状态: " + status);
        }
        return new TicTacToeState(board, turn, status, winner, line, difficulty);
    }

    // ----------- private helpers -----------

    private static Board decodeBoard(List<List<String>> rows) {
        if (rows == null || rows.size() != Board.SIZE) throw malformed("board 必须为 3 行");
        Mark[][] grid = new Mark[Board.SIZE][Board.SIZE];
        for (int r = 0; r < Board.SIZE; r++) {
            List<String> row = rows.get(r);
            if (row == null || row.size() != Board.SIZE) throw malformed("board 第 " + r + " 行必须为 3 列");
            for (int c = 0; c < Board.SIZE; c++) {
                Mark m = Mark.fromSymbol(row.get(c));
                if (m == null) throw malformed("board(" + r + "," + c + ") 取值非法: " + row.get(c));
                grid[r][c] = m;
            }
        }
        return Board.of(grid);
    }

    private static Mark decodePlayer(String symbol, String field) {
        Mark m = Mark.fromSymbol(symbol);
        if (m == null || m == Mark.EMPTY) throw malformed(field + " 取值非法: " + symbol);
        return m;
    }

    private static List<Position> decodeLine(List<List<Integer>> raw) {
        if (raw == null) return null;
        if (raw.size() != 3) throw malformed("winningLine 必须恰好 3 个坐标");
        List<Position> line = new ArrayList<>(3);
        for (List<Integer> pair : raw) {
            if (pair == null || pair.size() != 2 || pair.get(0) == null || pair.get(1) == null) {
                throw malformed("winningLine 坐标格式应为 [row,col]");
            }
            line.add(new Position(pair.get(0), pair.get(1)));
        }
        if (!TicTacToeJudge.isLine(line)) throw malformed("winningLine 不是合法的三连线: " + raw);
        return line;
    }

    private static MalformedStateException malformed(String detail) {
        return new MalformedStateException(detail);
    }
}
