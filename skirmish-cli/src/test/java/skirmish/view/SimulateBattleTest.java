package skirmish.view;

import com.google.gson.Gson;
import org.testng.Assert;
import org.testng.annotations.Test;
import picocli.CommandLine;
import skirmish.ai.AiProps;
import skirmish.cli.ExitCode;
import skirmish.cli.SimCommand;
import skirmish.cli.json.BattleReport;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Random;

public class SimulateBattleTest {

    private static SimCommand parse(String... args) {
        SimCommand cmd = new SimCommand();
        new CommandLine(cmd).parseArgs(args);
        return cmd;
    }

    private static BattleSetup setup(String... args) {
        SimCommand cmd = parse(args);
        return BattleSetup.fromOptions(cmd.getBattle(), cmd.getPlaystyles());
    }

    @Test
    public void testMinimaxDuel() {
        SimulateBattle.BattleResult result = SimulateBattle.runBattle(setup(), 1, new Random(1));
        Assert.assertEquals(result.endReason, SimulateBattle.EndReason.KNOCKOUT);
        Assert.assertFalse(result.isDraw);
        Assert.assertEquals(result.winnerIndex, 0);
        Assert.assertEquals(result.winnerName, "Ai(1)-Rogue");
        Assert.assertEquals(result.turns, 15);
        Assert.assertEquals(result.finalHp[0], 30);
        Assert.assertEquals(result.finalHp[1], 0);
        Assert.assertEquals(result.log.size(), 15);
        Assert.assertEquals(result.log.get(0),
                "Turn 1: Ai(1)-Rogue uses RogueSpecial. Ai(1)-Rogue (Rogue): 100/90 | Ai(2)-Mage (Mage): 88/100");
    }

    @Test
    public void testRestrictedDuel() {
        SimulateBattle.BattleResult result = SimulateBattle.runBattle(
                setup("-c", "vampire", "-c", "sorcerer", "--restricted"), 1, new Random(1));
        Assert.assertEquals(result.winnerIndex, 0);
        Assert.assertEquals(result.turns, 8);
        Assert.assertEquals(result.finalHp[0], 181);
    }

    @Test
    public void testRandomBattlesAlwaysFinish() {
        BattleSetup setup = setup("-c", "sorcerer", "-c", "vampire", "-s", "random", "-s", "random");
        Random random = new Random(7);
        int maxTurns = setup.getProfile().getIntProperty(AiProps.MAX_TURNS);
        for (int i = 1; i <= 50; i++) {
            SimulateBattle.BattleResult result = SimulateBattle.runBattle(setup, i, random);
            Assert.assertNotNull(result.endReason);
            Assert.assertTrue(result.turns <= maxTurns);
            if (result.isDraw) {
                Assert.assertEquals(result.winnerIndex, -1);
                Assert.assertNull(result.winnerName);
            } else {
                Assert.assertEquals(result.endReason, SimulateBattle.EndReason.KNOCKOUT);
                Assert.assertEquals(result.finalHp[1 - result.winnerIndex], 0);
            }
        }
    }

    @Test
    public void testTurnLimitIsDraw() {
        BattleSetup setup = setup("-s", "random", "-s", "random", "-P", "Debug", "--sp1", "100000", "--sp2", "100000",
                "--hp1", "100000", "--hp2", "100000");
        SimulateBattle.BattleResult result = SimulateBattle.runBattle(setup, 1, new Random(3));
        Assert.assertEquals(result.endReason, SimulateBattle.EndReason.TURN_LIMIT);
        Assert.assertTrue(result.isDraw);
        Assert.assertEquals(result.turns, 100);
    }

    @Test
    public void testExhaustedIsDraw() {
        BattleSetup setup = setup("--sp1", "2", "--sp2", "4");
        SimulateBattle.BattleResult result = SimulateBattle.runBattle(setup, 1, new Random(3));
        Assert.assertEquals(result.endReason, SimulateBattle.EndReason.EXHAUSTED);
        Assert.assertTrue(result.isDraw);
        Assert.assertEquals(result.turns, 0);
    }

    @Test
    public void testDoubleKnockoutIsDraw() {
        BattleSetup setup = setup("--hp1", "0", "--hp2", "0");
        SimulateBattle.BattleResult result = SimulateBattle.runBattle(setup, 1, new Random(3));
        Assert.assertEquals(result.endReason, SimulateBattle.EndReason.KNOCKOUT);
        Assert.assertTrue(result.isDraw);
    }

    @Test
    public void testJsonReport() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code = SimulateBattle.simulate(parse("-s", "random", "-s", "random", "-n", "6", "--seed", "11", "--json"),
                new PrintStream(out, true), new PrintStream(err, true));
        Assert.assertEquals(code, ExitCode.SUCCESS);

        BattleReport report = new Gson().fromJson(new String(out.toByteArray(), StandardCharsets.UTF_8), BattleReport.class);
        Assert.assertEquals(report.battles.size(), 6);
        Assert.assertEquals(report.config.seed, Long.valueOf(11));
        Assert.assertEquals(report.config.characters, Arrays.asList("ROGUE", "MAGE"));
        Assert.assertEquals(report.summary.totalBattles, 6);
        int wins = report.summary.players.get(0).wins + report.summary.players.get(1).wins;
        Assert.assertEquals(wins + report.summary.draws, 6);
        Assert.assertFalse(report.battles.get(0).log.isEmpty());
        Assert.assertEquals(report.battles.get(0).players.size(), 2);
    }

    @Test
    public void testCsvReport() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int code = SimulateBattle.simulate(parse("-s", "random", "-s", "random", "-n", "3", "--seed", "5", "--csv"),
                new PrintStream(out, true), new PrintStream(new ByteArrayOutputStream(), true));
        Assert.assertEquals(code, ExitCode.SUCCESS);

        String[] lines = new String(out.toByteArray(), StandardCharsets.UTF_8).split("\\R");
        Assert.assertEquals(lines[0], "battle,winner,winner_index,is_draw,turns,end_reason,p1_hp,p2_hp,duration_ms");
        Assert.assertTrue(lines[1].startsWith("1,"));
        Assert.assertEquals(lines[4], "");
        Assert.assertTrue(lines[5].startsWith("player_index,"));
        Assert.assertEquals(lines.length, 8);
    }

    @Test
    public void testSetupErrors() {
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        PrintStream errStream = new PrintStream(err, true);
        PrintStream out = new PrintStream(new ByteArrayOutputStream(), true);

        Assert.assertEquals(SimulateBattle.simulate(parse("-c", "paladin"), out, errStream), ExitCode.SETUP_ERROR);
        Assert.assertTrue(new String(err.toByteArray(), StandardCharsets.UTF_8).contains("paladin"));
        Assert.assertEquals(SimulateBattle.simulate(parse("-P", "Nope"), out, errStream), ExitCode.SETUP_ERROR);
        Assert.assertEquals(SimulateBattle.simulate(parse("-c", "rogue", "-c", "mage", "-c", "rogue"), out, errStream),
                ExitCode.SETUP_ERROR);
        Assert.assertEquals(SimulateBattle.simulate(parse("-n", "0"), out, errStream), ExitCode.ARGS_ERROR);
        Assert.assertEquals(SimulateBattle.simulate(parse("--json", "--csv"), out, errStream), ExitCode.ARGS_ERROR);
    }

    @Test
    public void testCsvEscape() {
        Assert.assertEquals(SimulateBattle.csvEscape("plain"), "plain");
        Assert.assertEquals(SimulateBattle.csvEscape("a,b"), "\"a,b\"");
        Assert.assertEquals(SimulateBattle.csvEscape("say \"hi\""), "\"say \"\"hi\"\"\"");
        Assert.assertEquals(SimulateBattle.csvEscape(null), "");
    }

    @Test
    public void testDefaultNames() {
        BattleSetup setup = BattleSetup.fromOptions(parse("--name", "Alice").getBattle(), Collections.<String>emptyList());
        Assert.assertEquals(setup.getName(0), "Alice");
        Assert.assertEquals(setup.getName(1), "Ai(2)-Mage");
    }
}
