package com.photonlab.backend.service.solver;

import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.SimulationResult;

/**
 * The Fourier-modal (RCWA) solver. Implementations must be safe to call from several workers at once.
 */
public interface SpectrumSolver {

    /**
     * @throws SolverException when the configuration cannot be solved or the solver is unreachable
     */
    SimulationResult simulate(SimulationConfig config);
}
