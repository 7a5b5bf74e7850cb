package com.largomodo.warehouse;

import com.largomodo.warehouse.core.AllocationObserver;
import com.largomodo.warehouse.core.BinRegistry;
import com.largomodo.warehouse.core.BinSource;
import com.largomodo.warehouse.core.ConveyorReport;
import com.largomodo.warehouse.core.ShipmentLog;
import com.largomodo.warehouse.core.ShipmentRecorder;
import com.largomodo.warehouse.core.UsageSink;
import com.largomodo.warehouse.core.Warehouse;
import com.largomodo.warehouse.core.domain.AllocationOutcome;
import com.largomodo.warehouse.core.domain.BacktrackingLoadOptimizer;
import com.largomodo.warehouse.core.domain.BinarySearchBinSelector;
import com.largomodo.warehouse.core.domain.Parcel;
import com.largomodo.warehouse.service.CsvBinStore;
import com.largomodo.warehouse.service.CsvParcelReader;
import com.largomodo.warehouse.service.CsvShipmentLog;
import com.largomodo.warehouse.service.InMemoryBinStore;
import com.largomodo.warehouse.service.InMemoryShipmentLog;
import com.largomodo.warehouse.service.ResourceBinSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for warehouse bin allocation and truck loading.
 * <p>
 * Uses Picocli for argument parsing with automatic help generation. One invocation runs, in order:
 * 1. Load bins (CSV bin file, or the bundled seed bins when --bins is omitted)
 * 2. Put --inbound parcels on the conveyor and allocate them by best fit
 * 3. Pick the fullest truck load from --truck-candidates and load it
 * 4. Undo the last --undo loads
 * <p>
 * --demo substitutes bundled inbound and truck files for steps 2 and 3 and undoes one load unless
 * --undo is given.
 */
@Command(
        name = "warehouse",
        mixinStandardHelpOptions = true,
        resourceBundle = "warehouse.warehouse",
        version = "${bundle:application.version}",
        header = "Allocates parcels to storage bins and plans truck loads.",
        description = {
                "Stores incoming parcels in the smallest storage bin that still has room for them,"
                        + " then fills a truck with the subset of candidate parcels that uses the most capacity.",
                "",
                "Bin usage is written back to the bin file after every stored parcel. Stored, loaded and"
                        + " removed parcels are recorded in the shipment log."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion (rejected parcels do not change the exit code)",
                "1:General execution error (I/O, malformed input files)",
                "2:Invalid command line arguments"
        }
)
public class WarehouseConsole implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WarehouseConsole.class);

    static final String DEMO_INBOUND = "/warehouse/demo-inbound.csv";
    static final String DEMO_TRUCK = "/warehouse/demo-truck.csv";

    @Option(names = {"-b", "--bins"}, paramLabel = "FILE",
            description = {
                    "CSV bin file (bin_id,capacity,current_usage,location_code).",
                    "Usage updates are written back to this file.",
                    "If omitted, the bundled seed bins are used in memory."
            })
    File binsFile;

    @Option(names = {"-i", "--inbound"}, paramLabel = "FILE",
            description = "CSV parcel file (tracking_id,size,destination) to run through the conveyor.")
    File inboundFile;

    @Option(names = {"-t", "--truck-candidates"}, paramLabel = "FILE",
            description = "CSV parcel file with the candidates for the next truck load.")
    File truckFile;

    @Option(names = {"-c", "--truck-capacity"}, defaultValue = "100",
            description = "Truck capacity (default: ${DEFAULT-VALUE}).")
    int truckCapacity;

    @Option(names = {"-u", "--undo"},
            description = "Number of truck loads to undo after loading (default: 0, or 1 with --demo).")
    Integer undoCount;

    @Option(names = {"-l", "--shipment-log"}, paramLabel = "FILE",
            description = "CSV shipment log to append to. If omitted, events are kept in memory.")
    File shipmentLogFile;

    @Option(names = "--max-search-nodes",
            description = "Stop the truck load search after this many nodes (default: exhaustive).")
    Long maxSearchNodes;

    @Option(names = "--demo", description = "Run the bundled sample inbound and truck files.")
    boolean demo;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new WarehouseConsole());
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        requireReadable(binsFile, "Bin file");
        requireReadable(inboundFile, "Inbound file");
        requireReadable(truckFile, "Truck candidates file");

        if (truckCapacity < 0) {
            throw new ParameterException(spec.commandLine(),
                    "Truck capacity must not be negative: " + truckCapacity);
        }
        if (undoCount != null && undoCount < 0) {
            throw new ParameterException(spec.commandLine(),
                    "Undo count must not be negative: " + undoCount);
        }
        if (maxSearchNodes != null && maxSearchNodes <= 0) {
            throw new ParameterException(spec.commandLine(),
                    "Max search nodes must be positive: " + maxSearchNodes);
        }
        if (demo && (inboundFile != null || truckFile != null)) {
            throw new ParameterException(spec.commandLine(),
                    "--demo cannot be combined with --inbound or --truck-candidates");
        }

        Warehouse warehouse = createWarehouse();
        warehouse.reloadInventory();

        CsvParcelReader parcelReader = new CsvParcelReader();
        List<Parcel> inbound = demo ? parcelReader.readResource(DEMO_INBOUND)
                : inboundFile != null ? parcelReader.read(inboundFile.toPath()) : List.of();
        List<Parcel> candidates = demo ? parcelReader.readResource(DEMO_TRUCK)
                : truckFile != null ? parcelReader.read(truckFile.toPath()) : List.of();
        int undo = undoCount != null ? undoCount : (demo ? 1 : 0);

        if (!inbound.isEmpty()) {
            runInbound(warehouse, inbound);
        }

        if (!candidates.isEmpty()) {
            log.info("Calculating best truck load for capacity {}...", truckCapacity);
            List<Parcel> load = warehouse.optimizeTruckSpace(candidates, truckCapacity);
            warehouse.loadTruck(load);
        }

        for (int i = 0; i < undo; i++) {
            if (warehouse.undoLastLoad().isEmpty()) {
                break;
            }
        }

        log.info("Truck holds {} parcel(s), total size {} of {}",
                warehouse.truck().size(), warehouse.truck().totalSize(), truckCapacity);
        return 0;
    }

    private static void runInbound(Warehouse warehouse, List<Parcel> inbound) {
        inbound.forEach(warehouse::addToConveyor);

        ConveyorReport report = warehouse.runConveyor(new AllocationObserver() {
            @Override
            public void onRejected(AllocationOutcome.Rejected rejected) {
                log.error("FAILED: {} (size {}) - {}", rejected.parcel().trackingId(),
                        rejected.parcel().size(), rejected.reason());
            }
        });

        log.info("Inbound complete: {} stored, {} rejected", report.storedCount(), report.rejectedCount());
    }

    /**
     * Wires collaborators from the command line options.
     */
    private Warehouse createWarehouse() throws IOException {
        BinSource binSource;
        UsageSink usageSink;
        if (binsFile != null) {
            CsvBinStore store = new CsvBinStore(binsFile.toPath());
            binSource = store;
            usageSink = store;
        } else {
            InMemoryBinStore store = InMemoryBinStore.copyOf(new ResourceBinSource());
            binSource = store;
            usageSink = store;
        }

        ShipmentLog shipmentLog = shipmentLogFile != null
                ? new CsvShipmentLog(shipmentLogFile.toPath())
                : new InMemoryShipmentLog();

        BacktrackingLoadOptimizer optimizer = maxSearchNodes != null
                ? new BacktrackingLoadOptimizer(maxSearchNodes)
                : new BacktrackingLoadOptimizer();

        BinRegistry registry = new BinRegistry(binSource, usageSink, new BinarySearchBinSelector());
        return new Warehouse(registry, optimizer, new ShipmentRecorder(shipmentLog));
    }

    private void requireReadable(File file, String label) {
        if (file == null) {
            return;
        }
        if (!file.isFile()) {
            throw new ParameterException(spec.commandLine(),
                    label + " does not exist or is not a file: " + file.getAbsolutePath());
        }
        if (!file.canRead()) {
            throw new ParameterException(spec.commandLine(),
                    label + " is not readable (check permissions): " + file.getAbsolutePath());
        }
    }
}
