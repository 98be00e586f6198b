package com.makemytrade.backtester.visualization;

import com.makemytrade.backtester.backtesting.model.BacktestResult;
import com.makemytrade.backtester.backtesting.model.EquityPoint;
import com.makemytrade.backtester.backtesting.model.Trade;
import com.makemytrade.backtester.backtesting.model.TradeType;
import lombok.extern.slf4j.Slf4j;
import org.knowm.xchart.BitmapEncoder;
import org.knowm.xchart.XYChart;
import org.knowm.xchart.XYChartBuilder;
import org.knowm.xchart.XYSeries;
import org.knowm.xchart.style.Styler;
import org.knowm.xchart.style.markers.SeriesMarkers;
import org.springframework.stereotype.Service;

import java.awt.*;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

@Service
@Slf4j
public class XChartVisualizer {

    public void generateEquityCurve(BacktestResult result, String directory) {
        if (result.getEquityCurve().isEmpty()) {
            return;
        }

        XYChart chart = new XYChartBuilder()
                .width(1200)
                .height(600)
                .title(result.getStrategyName() + " on " + result.getInstrument())
                .xAxisTitle("Time")
                .yAxisTitle("Equity")
                .build();

        chart.getStyler().setLegendPosition(Styler.LegendPosition.InsideNW);
        chart.getStyler().setDefaultSeriesRenderStyle(XYSeries.XYSeriesRenderStyle.Line);
        chart.getStyler().setDatePattern("yyyy-MM-dd");
        chart.getStyler().setXAxisTickMarkSpacingHint(100);

        List<Date> xData = new ArrayList<>();
        List<Double> yData = new ArrayList<>();
        for (EquityPoint point : result.getEquityCurve()) {
            xData.add(Date.from(point.getTimestamp()));
            yData.add(point.getEquity());
        }
        XYSeries equity = chart.addSeries("Equity", xData, yData);
        equity.setMarker(SeriesMarkers.NONE);
        equity.setLineColor(Color.BLUE);

        addTradeMarkers(chart, result, true, "Entries", Color.GREEN);
        addTradeMarkers(chart, result, false, "Exits", Color.RED);

        try {
            Files.createDirectories(Path.of(directory));
            String fileName = (result.getStrategyName() + "_" + result.getInstrument()).toLowerCase();
            BitmapEncoder.saveBitmap(chart, Path.of(directory, fileName).toString(), BitmapEncoder.BitmapFormat.PNG);
            log.info("Saved equity curve of {} to {}", result.getInstrument(), directory);
        } catch (IOException e) {
            log.error("Could not save the equity curve of {}", result.getInstrument(), e);
        }
    }

    // Markers sit on the equity curve at the bar of each trade
    private void addTradeMarkers(XYChart chart, BacktestResult result, boolean entries, String name, Color color) {
        List<Date> xData = new ArrayList<>();
        List<Double> yData = new ArrayList<>();
        int equityIndex = 0;
        List<EquityPoint> equityCurve = result.getEquityCurve();

        for (Trade trade : result.getTrades()) {
            boolean isEntry = trade.getType() == TradeType.BUY || trade.getType() == TradeType.ENTRY;
            if (isEntry != entries) {
                continue;
            }
            while (equityIndex < equityCurve.size() - 1
                    && equityCurve.get(equityIndex).getTimestamp().isBefore(trade.getTimestamp())) {
                equityIndex++;
            }
            xData.add(Date.from(trade.getTimestamp()));
            yData.add(equityCurve.get(equityIndex).getEquity());
        }

        if (xData.isEmpty()) {
            return;
        }
        XYSeries series = chart.addSeries(name, xData, yData);
        series.setXYSeriesRenderStyle(XYSeries.XYSeriesRenderStyle.Scatter);
        series.setMarker(SeriesMarkers.CIRCLE);
        series.setMarkerColor(color);
    }
}
