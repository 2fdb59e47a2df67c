/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.retrolz;

import java.util.Arrays;


/**
 * The {@code Global} class provides utility methods shared by the match
 * finders and the codecs.
 */
public class Global {

  /**
   * Private constructor to prevent instantiation.
   */
  private Global() {
  }


  /**
   * Return the number of bits required to represent {@code x} distinct values,
   * i.e. the base 2 logarithm rounded up. Returns 0 for values up to 1.
   *
   * @param x the number of values
   * @return ceil(log2(x))
   */
  public static int log2Ceil(int x) {
      if (x <= 1)
          return 0;

      return 32 - Integer.numberOfLeadingZeros(x - 1);
  }


  /**
   * Computes the distribution of jobs per task.
   *
   * <p>This method divides a specified number of jobs across a given number of tasks,
   * ensuring that jobs are distributed as evenly as possible.</p>
   *
   * @param jobsPerTask the array to hold the number of jobs assigned to each task
   * @param jobs the total number of jobs to distribute
   * @param tasks the total number of tasks
   * @return the updated jobsPerTask array
   * @throws IllegalArgumentException if the number of tasks or jobs is less than or equal to zero
   */
   public static int[] computeJobsPerTask(int[] jobsPerTask, int jobs, int tasks) {
      if (tasks <= 0)
         throw new IllegalArgumentException("Invalid number of tasks provided: "+tasks);

      if (jobs <= 0)
         throw new IllegalArgumentException("Invalid number of jobs provided: "+jobs);

      int q = (jobs <= tasks) ? 1 : jobs / tasks;
      int r = (jobs <= tasks) ? 0 : jobs - q*tasks;
      Arrays.fill(jobsPerTask, q);
      int n = 0;

      while (r != 0)
      {
         jobsPerTask[n]++;
         r--;
         n++;

         if (n == tasks)
            n = 0;
      }

      return jobsPerTask;
   }
}
